package com.trellissystems.graph;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate attached to an edge, deciding whether the edge may be traversed.
 *
 * <p>The {@link #sourceType()} selects the evaluation strategy: {@link ConditionSource#STRUCTURE}
 * conditions are checked against the owning {@link Graph}; {@link ConditionSource#EXECUTABLE}
 * conditions are checked by the remote actor that drives the traversal, which receives the edge
 * in a condition mail and answers with the result.
 */
public interface EdgeCondition {

    /**
     * Returns where this condition is evaluated.
     *
     * @return the condition source
     */
    ConditionSource sourceType();

    /**
     * Evaluates the condition.
     *
     * @param subject the graph for structure conditions, the evaluating actor for executable ones
     * @return true if the edge may be traversed
     */
    boolean check(Object subject);

    /**
     * Creates a condition evaluated against the graph.
     *
     * @param predicate the test
     * @return a structure condition
     */
    static EdgeCondition onStructure(Predicate<Graph> predicate) {
        return new StructureCondition(predicate);
    }

    /**
     * Creates a condition evaluated by a remote actor of the given type.
     *
     * @param subjectType the type of actor expected to evaluate the condition
     * @param predicate   the test
     * @param <S>         the subject type
     * @return an executable condition
     */
    static <S> EdgeCondition onExecutable(Class<S> subjectType, Predicate<? super S> predicate) {
        return new ExecutableCondition<>(subjectType, predicate);
    }

    record StructureCondition(Predicate<Graph> predicate) implements EdgeCondition {

        public StructureCondition {
            Objects.requireNonNull(predicate, "predicate cannot be null");
        }

        @Override
        public ConditionSource sourceType() {
            return ConditionSource.STRUCTURE;
        }

        @Override
        public boolean check(Object subject) {
            if (!(subject instanceof Graph)) {
                throw new IllegalArgumentException("Structure condition expects a Graph, got: " + subject);
            }
            return predicate.test((Graph) subject);
        }
    }

    record ExecutableCondition<S>(Class<S> subjectType, Predicate<? super S> predicate) implements EdgeCondition {

        public ExecutableCondition {
            Objects.requireNonNull(subjectType, "subjectType cannot be null");
            Objects.requireNonNull(predicate, "predicate cannot be null");
        }

        @Override
        public ConditionSource sourceType() {
            return ConditionSource.EXECUTABLE;
        }

        @Override
        public boolean check(Object subject) {
            if (!subjectType.isInstance(subject)) {
                throw new IllegalArgumentException("Executable condition expects "
                        + subjectType.getName() + ", got: " + subject);
            }
            return predicate.test(subjectType.cast(subject));
        }
    }
}
