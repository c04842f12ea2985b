package com.dpmfinder.common.selection;

/**
 * Parameters of {@link ResultSelector#select}.
 *
 * @param minDpm       strict threshold; results with {@code dpm <= minDpm} are dropped
 * @param labelMatcher optional label condition, {@code null} for none
 * @param topN         maximum number of results kept after sorting, {@code 0} for unlimited
 * @param sortBy       ordering of the selected results
 */
public record SelectionCriteria(double minDpm, LabelMatcher labelMatcher, int topN, SortKey sortBy) {

    public SelectionCriteria {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0, got " + topN);
        }
        sortBy = sortBy == null ? SortKey.DPM : sortBy;
    }

    public static SelectionCriteria threshold(double minDpm) {
        return new SelectionCriteria(minDpm, null, 0, SortKey.DPM);
    }

    public boolean hasLabelFilter() {
        return labelMatcher != null;
    }
}
