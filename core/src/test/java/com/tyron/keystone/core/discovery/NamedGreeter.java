package com.tyron.keystone.core.discovery;

public class NamedGreeter implements Greeter {

    private final String name;

    public NamedGreeter(String name) {
        this.name = name;
    }

    @Override
    public String greet() {
        return "hello " + name;
    }
}
