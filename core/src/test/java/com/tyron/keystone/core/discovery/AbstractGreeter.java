package com.tyron.keystone.core.discovery;

public abstract class AbstractGreeter implements Greeter {
}
