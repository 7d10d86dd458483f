package com.axlabs.neo.sharesgov;

import java.util.List;

/**
 * Utility for paging through stored entries.
 */
public class Paginator {

    private Paginator() {
    }

    /**
     * Calculates the start and end indices of a page in the list of {@code n} items.
     *
     * @param n            The total number of available items.
     * @param page         The desired page.
     * @param itemsPerPage The desired number of items per page.
     * @return The start and end index of items on the desired page, plus the total number of pages available given
     * that there are {@code n} items.
     */
    static int[] calcPagination(int n, int page, int itemsPerPage) {
        int pages;
        if (n < itemsPerPage) {
            pages = 1;
        } else if (n % itemsPerPage == 0) {
            pages = n / itemsPerPage;
        } else {
            pages = (n / itemsPerPage) + 1;
        }
        if (page >= pages) {
            throw new GovernanceException(ErrorKind.INVALID_ARGUMENT, "getProposals", "Page out of bounds");
        }
        int startAt = itemsPerPage * page;
        int endAt = startAt + itemsPerPage;
        if (startAt + itemsPerPage > n) {
            endAt = n;
        }
        return new int[]{startAt, endAt, pages};
    }

    /**
     * A page in a set of items, together with its page number and the total number of pages.
     */
    public static class Paginated<T> {
        public final int page;
        public final int pages;
        public final List<T> items;

        public Paginated(int page, int pages, List<T> items) {
            this.page = page;
            this.pages = pages;
            this.items = items;
        }
    }
}
