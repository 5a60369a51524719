package com.gs.ep.pagetranslator.model;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Outcome of translating one document: the terminal state of each page plus unit counters.
 */
public final class DocumentReport {
    private final MutableList<PageState> pageStates = Lists.mutable.empty();
    private int unitCount;
    private int fallbackUnitCount;

    public void recordPage(int pageIndex, PageState state) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Page " + pageIndex + " is not in a terminal state: " + state);
        }
        while (pageStates.size() <= pageIndex) {
            pageStates.add(null);
        }
        pageStates.set(pageIndex, state);
    }

    public void addUnits(int units, int fallbackUnits) {
        this.unitCount += units;
        this.fallbackUnitCount += fallbackUnits;
    }

    public PageState getPageState(int pageIndex) {
        return pageStates.get(pageIndex);
    }

    public ListIterable<PageState> getPageStates() {
        return pageStates.asUnmodifiable();
    }

    public int getPageCount() {
        return pageStates.size();
    }

    public int count(PageState state) {
        return pageStates.count(state::equals);
    }

    public int getUnitCount() {
        return unitCount;
    }

    public int getFallbackUnitCount() {
        return fallbackUnitCount;
    }

    @Override
    public String toString() {
        return String.format("pages=%d done=%d skipped=%d failed=%d units=%d fallbackUnits=%d",
                getPageCount(), count(PageState.DONE), count(PageState.SKIPPED), count(PageState.FAILED),
                unitCount, fallbackUnitCount);
    }
}
