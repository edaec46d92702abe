package com.phillippitts.livescribe.service.align;

/**
 * Longest common contiguous substring by dynamic programming over two rolling rows.
 */
final class LongestCommonSubstring {

    /**
     * @param aStart start offset of the match in the first string
     * @param bStart start offset of the match in the second string
     * @param size   match length (0 when nothing matches)
     */
    record Match(int aStart, int bStart, int size) {
        static final Match NONE = new Match(0, 0, 0);
    }

    private LongestCommonSubstring() {}

    /**
     * Finds the longest run shared by {@code a[aFrom..]} and {@code b}. Among equally long runs the one
     * starting earliest in {@code a} wins. The returned {@code aStart} is absolute within {@code a}.
     */
    static Match find(String a, int aFrom, String b) {
        int n = a.length();
        int m = b.length();
        if (aFrom >= n || m == 0) {
            return Match.NONE;
        }
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        int bestSize = 0;
        int bestAEnd = 0;
        int bestBEnd = 0;
        for (int i = aFrom; i < n; i++) {
            char ca = a.charAt(i);
            for (int j = 1; j <= m; j++) {
                if (ca == b.charAt(j - 1)) {
                    int len = prev[j - 1] + 1;
                    curr[j] = len;
                    if (len > bestSize) {
                        bestSize = len;
                        bestAEnd = i + 1;
                        bestBEnd = j;
                    }
                } else {
                    curr[j] = 0;
                }
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        if (bestSize == 0) {
            return Match.NONE;
        }
        return new Match(bestAEnd - bestSize, bestBEnd - bestSize, bestSize);
    }
}
