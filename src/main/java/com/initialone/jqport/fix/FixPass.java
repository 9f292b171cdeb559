package com.initialone.jqport.fix;

/**
 * One text-in / text-out repair over a converted script. Implementations must be idempotent:
 * applying a pass to its own output returns that output unchanged.
 */
public interface FixPass {

    String name();

    String apply(String text);
}
