package ai.asserttagger.tagging;

import java.util.List;
import java.util.stream.Collectors;

/** The collection phase found problems, so no file was modified and no mapping file was written. */
public class TaggingAbortedException extends Exception {
    private final List<TaggingProblem> problems;

    public TaggingAbortedException(List<TaggingProblem> problems) {
        super(problems.size() + " problem(s) found; no files were modified:\n"
                + problems.stream().map(TaggingProblem::render).collect(Collectors.joining("\n")));
        this.problems = List.copyOf(problems);
    }

    public List<TaggingProblem> getProblems() {
        return problems;
    }
}
