package de.upb.sse.jrefactor.search;

import de.upb.sse.jrefactor.ast.AstVisitor;
import de.upb.sse.jrefactor.ast.Cursor;
import de.upb.sse.jrefactor.ast.Tr;

/**
 * Whether a compilation unit imports a type, by exact, star or static import.
 */
public class HasImport extends AstVisitor<Boolean> {
    private final String fullyQualifiedName;

    public HasImport(String fullyQualifiedName) {
        super(false);
        this.fullyQualifiedName = fullyQualifiedName;
    }

    @Override
    public Boolean visitImport(Tr.Import impoort, Cursor cursor) {
        return impoort.matches(fullyQualifiedName);
    }

    @Override
    public Boolean visitClassDecl(Tr.ClassDecl classDecl, Cursor cursor) {
        // imports never appear below a type declaration
        return false;
    }
}
