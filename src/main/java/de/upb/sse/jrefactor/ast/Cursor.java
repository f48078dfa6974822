package de.upb.sse.jrefactor.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable chain of ancestors from the root of a traversal down to the node being visited.
 *
 * Every step of a traversal pushes a new cursor; the parent chain is shared, never modified.
 */
public final class Cursor {
    public static final Cursor ROOT = new Cursor(null, null);

    private final Cursor parent;
    private final Tr tree;

    private Cursor(Cursor parent, Tr tree) {
        this.parent = parent;
        this.tree = tree;
    }

    public Cursor push(Tr tree) {
        return new Cursor(this, tree);
    }

    /**
     * The node this cursor points at, null for {@link #ROOT}.
     */
    public Tr getTree() {
        return tree;
    }

    public Cursor getParent() {
        return parent == null ? ROOT : parent;
    }

    public Tr getParentTree() {
        return getParent().getTree();
    }

    public boolean isRoot() {
        return tree == null;
    }

    /**
     * Nodes from the root down to and including the current one.
     */
    public List<Tr> getPath() {
        List<Tr> path = new ArrayList<>();
        for (Cursor c = this; c != null && c.tree != null; c = c.parent) {
            path.add(c.tree);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * The nearest node of the given kind, starting at the current node itself.
     */
    public <T extends Tr> T firstEnclosing(Class<T> kind) {
        for (Cursor c = this; c != null && c.tree != null; c = c.parent) {
            if (kind.isInstance(c.tree)) return kind.cast(c.tree);
        }
        return null;
    }

    public Tr.CompilationUnit enclosingCompilationUnit() {
        return firstEnclosing(Tr.CompilationUnit.class);
    }

    public Tr.ClassDecl enclosingClass() {
        return firstEnclosing(Tr.ClassDecl.class);
    }

    public Tr.MethodDecl enclosingMethod() {
        return firstEnclosing(Tr.MethodDecl.class);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Cursor{");
        for (Tr t : getPath()) {
            sb.append('/').append(t.getClass().getSimpleName());
        }
        return sb.append('}').toString();
    }
}
