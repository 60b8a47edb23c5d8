package com.example.main_image_selection.selector;

import com.example.main_image_selection.model.DecidedBy;
import com.example.main_image_selection.model.ScoredImage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.main_image_selection.selector.RankingMainImageSelectorTest.scored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TieBreakChainTest {

    @Test
    void standardChainOrdersByScoreThenRankThenImageId() {
        ScoredImage a = scored("H1", "IMG_B", 0.9, null);
        ScoredImage b = scored("H1", "IMG_A", 0.7, 2);
        ScoredImage c = scored("H1", "IMG_C", 0.7, 1);
        ScoredImage d = scored("H1", "IMG_A2", 0.7, null);
        ScoredImage e = scored("H1", "IMG_A1", 0.7, null);

        List<ScoredImage> sorted = new ArrayList<>(List.of(e, d, b, a, c));
        sorted.sort(TieBreakChain.standard());

        assertThat(sorted).containsExactly(a, c, b, e, d);
        assertThat(TieBreakChain.standard().decidingLevel(c, b)).isEqualTo(DecidedBy.PRIORITY_RANK);
        assertThat(TieBreakChain.standard().decidingLevel(e, d)).isEqualTo(DecidedBy.IMAGE_ID);
        assertThat(TieBreakChain.standard().decidingLevel(a, a)).isNull();
    }

    @Test
    void comparatorIsAntisymmetric() {
        TieBreakChain chain = TieBreakChain.standard();
        ScoredImage x = scored("H1", "IMG_1", 0.5, 4);
        ScoredImage y = scored("H1", "IMG_2", 0.5, null);

        assertThat(Integer.signum(chain.compare(x, y))).isEqualTo(-Integer.signum(chain.compare(y, x)));
        assertThat(chain.best(x, y)).isSameAs(chain.best(y, x));
    }

    @Test
    void levelsCanBeAppended() {
        TieBreakChain byIdDescending = TieBreakChain.builder()
                .then(DecidedBy.SCORE, ScoredImage::score, TieBreakChain.Direction.DESCENDING)
                .then(DecidedBy.IMAGE_ID, ScoredImage::imageId, TieBreakChain.Direction.DESCENDING)
                .build();

        assertThat(byIdDescending.best(scored("H5", "IMG_9", 0.8), scored("H5", "IMG_2", 0.8)).imageId()).isEqualTo("IMG_9");
        assertThatThrownBy(() -> TieBreakChain.builder().build()).isInstanceOf(IllegalStateException.class);
    }
}
