package io.github.hide212131.langchain4j.mentor.runtime.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** How a value in a {@link StateDelta} is combined with the stored value. */
public enum MergeStrategy {
    OVERWRITE {
        @Override
        public Object merge(Object current, Object incoming) {
            return incoming;
        }
    },
    APPEND {
        @Override
        public Object merge(Object current, Object incoming) {
            List<Object> merged = new ArrayList<>();
            if (current instanceof Collection<?> existing) {
                merged.addAll(existing);
            } else if (current != null) {
                merged.add(current);
            }
            if (incoming instanceof Collection<?> added) {
                merged.addAll(added);
            } else if (incoming != null) {
                merged.add(incoming);
            }
            return merged;
        }
    };

    public abstract Object merge(Object current, Object incoming);
}
