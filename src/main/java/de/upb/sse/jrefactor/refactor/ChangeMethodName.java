package de.upb.sse.jrefactor.refactor;

import de.upb.sse.jrefactor.ast.AstTransformer;
import de.upb.sse.jrefactor.ast.Cursor;
import de.upb.sse.jrefactor.ast.Tr;
import de.upb.sse.jrefactor.search.MethodMatcher;

/**
 * Renames every invocation matching a method pattern. The name keeps its formatting, and the
 * invocation's type is left as resolved since the declaration itself is not touched.
 */
public class ChangeMethodName extends AstTransformer {
    private final MethodMatcher matcher;
    private final String newName;

    public ChangeMethodName(String signature, String newName) {
        this.matcher = new MethodMatcher(signature);
        this.newName = newName;
    }

    @Override
    public Tr visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
        Tr.MethodInvocation transformed = (Tr.MethodInvocation) super.visitMethodInvocation(meth, cursor);
        if (matcher.matches(meth) && !meth.getSimpleName().equals(newName)) {
            return transformed.withName(transformed.getName().withName(newName));
        }
        return transformed;
    }
}
