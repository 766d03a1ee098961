package ai.asserttagger.tagging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State shared by every package of one run: the short-code registry, the code-to-message table and the problems
 * found so far.
 *
 * <p>A run starts in {@link Phase#VALIDATING}, where problems accumulate and nothing is written. {@link #beginMutation()}
 * moves it to {@link Phase#MUTATING} exactly once, and only if no problem was recorded; there is no way back.
 */
public class TaggingRun {
    public enum Phase {
        VALIDATING,
        MUTATING
    }

    private final ShortCodeRegistry registry = new ShortCodeRegistry();
    private final CodeToMessageTable messages = new CodeToMessageTable();
    private final List<TaggingProblem> problems = new ArrayList<>();
    private Phase phase = Phase.VALIDATING;

    public ShortCodeRegistry registry() {
        return registry;
    }

    public CodeToMessageTable messages() {
        return messages;
    }

    public Phase phase() {
        return phase;
    }

    public void addProblem(TaggingProblem problem) {
        requirePhase(Phase.VALIDATING);
        problems.add(problem);
    }

    public List<TaggingProblem> problems() {
        return Collections.unmodifiableList(problems);
    }

    /**
     * Leaves validation.
     *
     * @throws TaggingAbortedException if any problem was recorded; the run stays in {@link Phase#VALIDATING}
     * @throws IllegalStateException if mutation already began
     */
    public void beginMutation() throws TaggingAbortedException {
        requirePhase(Phase.VALIDATING);
        if (!problems.isEmpty()) {
            throw new TaggingAbortedException(problems);
        }
        phase = Phase.MUTATING;
    }

    void requirePhase(Phase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Run is " + phase + ", expected " + expected);
        }
    }
}
