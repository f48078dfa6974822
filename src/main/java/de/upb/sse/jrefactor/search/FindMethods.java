package de.upb.sse.jrefactor.search;

import de.upb.sse.jrefactor.ast.AstVisitor;
import de.upb.sse.jrefactor.ast.Cursor;
import de.upb.sse.jrefactor.ast.Tr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects every invocation matching a method pattern, in source order. Calls nested in the
 * arguments or select of a matching call are collected too.
 */
public class FindMethods extends AstVisitor<List<Tr.MethodInvocation>> {
    private final MethodMatcher matcher;

    public FindMethods(String signature) {
        this(new MethodMatcher(signature));
    }

    public FindMethods(MethodMatcher matcher) {
        super(Collections.emptyList());
        this.matcher = matcher;
    }

    @Override
    public List<Tr.MethodInvocation> reduce(List<Tr.MethodInvocation> r1, List<Tr.MethodInvocation> r2) {
        if (r1.isEmpty()) return r2;
        if (r2.isEmpty()) return r1;
        List<Tr.MethodInvocation> all = new ArrayList<>(r1);
        all.addAll(r2);
        return all;
    }

    @Override
    public List<Tr.MethodInvocation> visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
        List<Tr.MethodInvocation> nested = super.visitMethodInvocation(meth, cursor);
        if (matcher.matches(meth)) {
            return reduce(Collections.singletonList(meth), nested);
        }
        return nested;
    }
}
