package com.graphdraw.lgl.order;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts resolved entries by value. Entries without a value are not sorted:
 * they are put back at their previous index once enough sorted nodes precede
 * it. Ties keep their previous relative order, or the reverse when biased to
 * the right.
 */
final class EntrySorter {

    private EntrySorter() {
    }

    static SortEntry sort(List<SortEntry> entries, boolean biasRight) {
        List<SortEntry> sortable = new ArrayList<>();
        List<SortEntry> unsortable = new ArrayList<>();
        for (SortEntry entry : entries) {
            if (entry.hasValue())
                sortable.add(entry);
            else
                unsortable.add(entry);
        }
        unsortable.sort((a, b) -> Integer.compare(b.i, a.i));
        sortable.sort(compareWithBias(biasRight));

        List<String> vs = new ArrayList<>();
        double sum = 0;
        double weight = 0;
        int vsIndex = consumeUnsortable(vs, unsortable, 0);
        for (SortEntry entry : sortable) {
            vsIndex += entry.vs.size();
            vs.addAll(entry.vs);
            sum += entry.value * entry.weight;
            weight += entry.weight;
            vsIndex = consumeUnsortable(vs, unsortable, vsIndex);
        }

        SortEntry result = new SortEntry(vs);
        if (weight > 0) {
            result.value = sum / weight;
            result.weight = weight;
        }
        return result;
    }

    private static int consumeUnsortable(List<String> vs, List<SortEntry> unsortable, int index) {
        while (!unsortable.isEmpty()) {
            SortEntry last = unsortable.get(unsortable.size() - 1);
            if (last.i > index)
                break;
            unsortable.remove(unsortable.size() - 1);
            vs.addAll(last.vs);
            index++;
        }
        return index;
    }

    private static Comparator<SortEntry> compareWithBias(boolean biasRight) {
        return (a, b) -> {
            int c = Double.compare(a.value, b.value);
            if (c != 0)
                return c;
            return biasRight ? Integer.compare(b.i, a.i) : Integer.compare(a.i, b.i);
        };
    }
}
