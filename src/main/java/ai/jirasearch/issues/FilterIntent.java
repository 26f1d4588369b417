package ai.jirasearch.issues;

import java.util.List;

/** What the user asked to search for. Concrete records carry the filter-specific data. */
public sealed interface FilterIntent permits FilterIntent.ByAssignee, FilterIntent.ByLabel, FilterIntent.ByLabels {

    /** Short human-readable form used in the listing header, e.g. {@code labels(all)=a,b}. */
    String describe();

    record ByAssignee(String username) implements FilterIntent {
        @Override
        public String describe() {
            return "assignee=" + username;
        }
    }

    record ByLabel(String label) implements FilterIntent {
        @Override
        public String describe() {
            return "label=" + label;
        }
    }

    record ByLabels(List<String> labels, boolean matchAll) implements FilterIntent {
        public ByLabels {
            if (labels.isEmpty()) {
                throw new IllegalArgumentException("At least one label is required");
            }
            labels = List.copyOf(labels);
        }

        @Override
        public String describe() {
            return "labels(%s)=%s".formatted(matchAll ? "all" : "any", String.join(",", labels));
        }
    }
}
