package com.tyron.keystone.api.component;

/**
 * Custom initialization hook, invoked right after a component is constructed during
 * {@link ComponentRegistry#initializeAll()}.
 */
public interface Initializable {

    void initialize() throws Exception;
}
