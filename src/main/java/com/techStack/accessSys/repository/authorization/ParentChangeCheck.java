package com.techStack.accessSys.repository.authorization;

import java.util.function.Function;

/**
 * Verification run by the store inside the same atomic unit as a parent-pointer
 * write. It sees the hierarchy as it is before the write and throws to abort it.
 */
@FunctionalInterface
public interface ParentChangeCheck {

    void verify(Function<String, String> currentParentOf);
}
