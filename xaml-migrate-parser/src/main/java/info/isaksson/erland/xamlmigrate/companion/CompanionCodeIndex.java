package info.isaksson.erland.xamlmigrate.companion;

import java.util.List;

/**
 * Oracle over the companion code of a project: which units exist and what they declare.
 *
 * <p>Used only to validate linkage from markup to code; it never drives tree transformation.</p>
 */
public interface CompanionCodeIndex {

    /** Unit with exactly this qualified name, or null. */
    CompanionUnit findUnit(String qualifiedName);

    /** Units whose simple name matches, in index order. */
    List<CompanionUnit> findBySimpleName(String simpleName);
}
