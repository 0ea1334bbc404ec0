package com.gt.vocab.fuzzy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Not thread safe; the row buffers are reused between calls
public class LevenshteinMatcher {

    private List<Integer> v0 = new ArrayList<>();
    private List<Integer> v1 = new ArrayList<>();

    /**
     * Similarity in [0, 1]: 1 for identical strings, 0 when every character must change.
     */
    public double similarity(String left, String right) {
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }

        return 1.0 - (double) levenshteinDistance(left, right, maxLength) / maxLength;
    }

    // Gives up early and returns maxDistance + 1 once every prefix alignment exceeds maxDistance
    public int levenshteinDistance(String left, String right, int maxDistance) {
        initializeLists(right.length() + 1);

        for (int i = 0; i < left.length(); i++) {
            v1.set(0, i + 1);

            for (int j = 0; j < right.length(); j++) {
                int delCost = v0.get(j + 1) + 1;
                int insertCost = v1.get(j) + 1;
                int subCost = left.charAt(i) == right.charAt(j) ? v0.get(j) : v0.get(j) + 1;

                v1.set(j + 1, Integer.min(Integer.min(delCost, insertCost), subCost));
            }

            if (Collections.min(v1) > maxDistance) {
                return maxDistance + 1;
            }

            swapLists();
        }

        return v0.get(right.length());
    }

    private void initializeLists(int size) {
        v0.clear();
        v1.clear();
        for (int i = 0; i < size; i++) {
            v0.add(i);
            v1.add(0);
        }
    }

    private void swapLists() {
        List<Integer> temp = v0;
        v0 = v1;
        v1 = temp;
    }
}
