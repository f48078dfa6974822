package de.upb.sse.jrefactor.refactor;

import de.upb.sse.jrefactor.ast.AstTransformer;
import de.upb.sse.jrefactor.ast.Cursor;
import de.upb.sse.jrefactor.ast.Tr;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the single type import of a fully qualified name. Star and static imports are left alone.
 *
 * When the first import goes, the import after it takes over its prefix so the blank line after
 * the package declaration survives.
 */
public class RemoveImport extends AstTransformer {
    private final String fullyQualifiedName;

    public RemoveImport(String fullyQualifiedName) {
        this.fullyQualifiedName = fullyQualifiedName;
    }

    @Override
    public Tr visitCompilationUnit(Tr.CompilationUnit cu, Cursor cursor) {
        List<Tr.Import> imports = cu.getImports();
        List<Tr.Import> kept = new ArrayList<>(imports.size());
        String pendingPrefix = null;

        for (int i = 0; i < imports.size(); i++) {
            Tr.Import impoort = imports.get(i);
            if (!impoort.isStatic() && !impoort.isStar() && impoort.getTypeName().equals(fullyQualifiedName)) {
                if (i == 0) pendingPrefix = impoort.getFormatting().getPrefix();
                continue;
            }
            if (pendingPrefix != null) {
                impoort = (Tr.Import) impoort.withPrefix(pendingPrefix);
                pendingPrefix = null;
            }
            kept.add(impoort);
        }

        if (kept.size() == imports.size()) return cu;

        Tr.CompilationUnit result = cu.withImports(kept);
        if (pendingPrefix != null && result.getPackageDecl() == null && !result.getClasses().isEmpty()) {
            // every import was removed, the first type declaration moves to the top of the file
            List<Tr> classes = new ArrayList<>(result.getClasses());
            classes.set(0, classes.get(0).withPrefix(pendingPrefix));
            result = result.withClasses(classes);
        }
        return result;
    }
}
