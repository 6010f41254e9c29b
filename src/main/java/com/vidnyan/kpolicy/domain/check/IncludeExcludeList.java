package com.vidnyan.kpolicy.domain.check;

import java.util.List;

/**
 * Include/exclude filter over plain string values.
 * An empty include list admits everything that is not excluded.
 */
public record IncludeExcludeList(
    List<String> include,
    List<String> exclude
) {

    public static final IncludeExcludeList ANY = new IncludeExcludeList(List.of(), List.of());

    public IncludeExcludeList {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public boolean admits(String value) {
        boolean included = include.isEmpty() || include.contains(value);
        return included && !exclude.contains(value);
    }
}
