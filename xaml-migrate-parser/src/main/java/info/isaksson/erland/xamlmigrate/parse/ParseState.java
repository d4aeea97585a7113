package info.isaksson.erland.xamlmigrate.parse;

/** Phases of one hybrid parse. {@link #DONE}, {@link #STRUCTURAL_ONLY} and {@link #FAILED} are terminal. */
public enum ParseState {
    IDLE,
    STRUCTURAL_PARSING,
    SEMANTIC_PARSING,
    MERGING,
    DONE,
    /** Structural tree available, semantic layer skipped or failed. */
    STRUCTURAL_ONLY,
    /** Structural parse failed; no document. */
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == STRUCTURAL_ONLY || this == FAILED;
    }
}
