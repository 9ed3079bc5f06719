package com.motaz.uptake.core.impact;

import com.motaz.uptake.core.model.LikelyCause;
import lombok.Value;

import java.util.function.Predicate;

/** One row of the cause decision table. */
@Value
public class CauseRule {
    String name;
    Predicate<EventShape> predicate;
    LikelyCause cause;

    public boolean matches(EventShape shape) {
        return predicate.test(shape);
    }
}
