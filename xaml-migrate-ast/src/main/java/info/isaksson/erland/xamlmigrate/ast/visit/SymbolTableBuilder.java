package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.SymbolTable;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;

import java.util.Map;

/**
 * Derives a {@link SymbolTable} from a finished tree in one walk: prefixes on the way down, names and
 * type usages post-order, so registration never runs ahead of construction.
 */
public final class SymbolTableBuilder implements XamlVisitor {

    private final SymbolTable table = new SymbolTable();

    private SymbolTableBuilder() {}

    public static SymbolTable build(XamlElement root) {
        SymbolTableBuilder b = new SymbolTableBuilder();
        if (root != null) {
            XamlWalker.walk(root, b);
        }
        return b.table;
    }

    @Override
    public VisitResult visitElement(XamlElement element) {
        for (Map.Entry<String, String> e : element.getNamespaceDeclarations().entrySet()) {
            table.registerPrefix(e.getKey(), e.getValue());
        }
        return VisitResult.CONTINUE;
    }

    @Override
    public VisitResult endElement(XamlElement element) {
        if (element.isSynthetic()) return VisitResult.CONTINUE;
        String name = element.getXName();
        if (name != null && !name.isEmpty()) {
            table.registerName(name, element);
        }
        table.registerTypeUsage(element.getTypeName(), element);
        return VisitResult.CONTINUE;
    }
}
