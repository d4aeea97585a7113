package info.isaksson.erland.xamlmigrate.transform;

/**
 * A unit of tree rewriting scoped to one node category.
 *
 * <p>Within a pass the engine offers each node to the rules of its category in descending priority order
 * and applies only the first rule whose {@code canApply} accepts it.</p>
 */
public interface TransformationRule {

    String name();

    /** Higher runs first. Rules with equal priority keep their registration order. */
    default int priority() {
        return 0;
    }
}
