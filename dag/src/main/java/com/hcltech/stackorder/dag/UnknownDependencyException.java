package com.hcltech.stackorder.dag;

/** A stack declared a dependency on an identifier that has no directory. */
public class UnknownDependencyException extends IllegalArgumentException {
    private final String stackId;
    private final String dependencyId;

    public UnknownDependencyException(String stackId, String dependencyId) {
        super("Unknown dependency detected: non-existent " + dependencyId + " found in " + stackId);
        this.stackId = stackId;
        this.dependencyId = dependencyId;
    }

    public String stackId() {
        return stackId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
