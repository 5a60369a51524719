package com.gs.ep.pagetranslator.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Text units of one page paired with their translations; the input of the compositor.
 */
public final class PageRenderPlan {
    private final int pageIndex;
    private final ImmutableList<Pair<TextUnit, String>> entries;

    private PageRenderPlan(int pageIndex, ImmutableList<Pair<TextUnit, String>> entries) {
        this.pageIndex = pageIndex;
        this.entries = entries;
    }

    public static PageRenderPlan of(int pageIndex, List<TextUnit> units, List<String> translations) {
        if (units.size() != translations.size()) {
            throw new IllegalArgumentException("Got " + translations.size() + " translations for "
                    + units.size() + " units on page " + pageIndex);
        }
        ImmutableList<Pair<TextUnit, String>> pairs = Lists.mutable.withAll(units)
                .zip(translations)
                .toImmutable();
        return new PageRenderPlan(pageIndex, pairs);
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public ListIterable<Pair<TextUnit, String>> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
