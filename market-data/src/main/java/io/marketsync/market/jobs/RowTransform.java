package io.marketsync.market.jobs;

import io.marketsync.core.Row;

import java.util.List;

/** Post-processing applied to the rows of one fetch before they are written. */
@FunctionalInterface
public interface RowTransform {
    List<Row> apply(List<Row> rows);

    default RowTransform andThen(RowTransform next) {
        return rows -> next.apply(apply(rows));
    }

    static RowTransform identity() {
        return rows -> rows;
    }
}
