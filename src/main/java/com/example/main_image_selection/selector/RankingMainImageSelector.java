package com.example.main_image_selection.selector;

import com.example.main_image_selection.model.DecidedBy;
import com.example.main_image_selection.model.RankMetadata;
import com.example.main_image_selection.model.ScoredImage;
import com.example.main_image_selection.model.Selection;
import com.example.main_image_selection.model.SelectionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Default selector ranking candidates with a {@link TieBreakChain}.
 */
public class RankingMainImageSelector implements MainImageSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(RankingMainImageSelector.class);

    private final TieBreakChain chain;
    private final SelectorConfig config;

    public RankingMainImageSelector(TieBreakChain chain, SelectorConfig config) {
        this.chain = chain == null ? TieBreakChain.standard() : chain;
        this.config = config == null ? SelectorConfig.defaults() : config;
    }

    public RankingMainImageSelector(SelectorConfig config) {
        this(TieBreakChain.standard(), config);
    }

    public SelectorConfig config() {
        return config;
    }

    @Override
    public HotelRanking rank(Collection<ScoredImage> candidates) {
        Map<String, HotelCandidates> byHotel = new HashMap<>();
        for (ScoredImage candidate : candidates) {
            byHotel.merge(candidate.hotelId(), HotelCandidates.of(candidate), (a, b) -> a.combine(b, chain));
        }
        return new HotelRanking(byHotel);
    }

    @Override
    public HotelRanking merge(List<HotelRanking> partials) {
        HotelRanking merged = HotelRanking.empty();
        for (HotelRanking partial : partials) {
            merged = merged.merge(partial, chain);
        }
        return merged;
    }

    @Override
    public SelectionResult finish(HotelRanking ranking) {
        List<Selection> selections = new ArrayList<>(ranking.hotelCount());
        TreeSet<String> suppressed = new TreeSet<>();
        for (Map.Entry<String, HotelCandidates> entry : ranking.byHotel().entrySet()) {
            String hotelId = entry.getKey();
            HotelCandidates candidates = entry.getValue();
            boolean disqualifiedOnly = candidates.disqualifiedOnly();
            if (disqualifiedOnly && config.disqualifiedPolicy() == DisqualifiedPolicy.NO_SELECTION) {
                suppressed.add(hotelId);
                LOGGER.debug("selector suppress hotelId={} candidates={} all disqualified", hotelId, candidates.candidateCount());
                continue;
            }
            ScoredImage best = candidates.best();
            ScoredImage runnerUp = candidates.runnerUp();
            DecidedBy decidedBy = runnerUp == null ? DecidedBy.SOLE_CANDIDATE : decidedBy(best, runnerUp);
            RankMetadata metadata = new RankMetadata(candidates.candidateCount(), candidates.disqualifiedCount(),
                    disqualifiedOnly, decidedBy, runnerUp == null ? null : runnerUp.imageId());
            selections.add(new Selection(hotelId, best.imageId(), best.score(), metadata));
            LOGGER.trace("selector hotelId={} winner={} score={} decidedBy={} runnerUp={}", hotelId, best.imageId(),
                    String.format(Locale.ROOT, "%.4f", best.score()), decidedBy, metadata.runnerUpImageId());
        }
        SelectionSet selectionSet = SelectionSet.of(selections);
        LOGGER.debug("selector hotels={} selected={} suppressed={} policy={}",
                ranking.hotelCount(), selectionSet.size(), suppressed.size(), config.disqualifiedPolicy());
        return new SelectionResult(selectionSet,
                Collections.unmodifiableSet(new TreeSet<>(ranking.byHotel().keySet())),
                Collections.unmodifiableSet(suppressed));
    }

    private DecidedBy decidedBy(ScoredImage best, ScoredImage runnerUp) {
        DecidedBy level = chain.decidingLevel(best, runnerUp);
        return level == null ? DecidedBy.IMAGE_ID : level;
    }
}
