package com.croppulse.decision.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreditGradeTest {

    @ParameterizedTest
    @CsvSource({
            "0, F", "499, F",
            "500, D", "599, D",
            "600, C", "699, C",
            "700, B", "799, B",
            "800, A", "1000, A"
    })
    void fromScore_boundaries(int score, CreditGrade expected) {
        assertThat(CreditGrade.fromScore(score)).isEqualTo(expected);
    }

    @Test
    void fromScore_everyIntegerMapsToExactlyOneGrade() {
        Map<CreditGrade, Integer> counts = new EnumMap<>(CreditGrade.class);
        CreditGrade previous = CreditGrade.F;
        for (int score = 0; score <= CreditGrade.MAX_SCORE; score++) {
            CreditGrade grade = CreditGrade.fromScore(score);
            int matching = 0;
            for (CreditGrade g : CreditGrade.values()) {
                int upper = g.ordinal() == 0 ? CreditGrade.MAX_SCORE : CreditGrade.values()[g.ordinal() - 1].getMinScore() - 1;
                if (score >= g.getMinScore() && score <= upper) {
                    matching++;
                }
            }
            assertThat(matching).as("score %d", score).isEqualTo(1);
            assertThat(grade.ordinal()).as("grades never improve as the score drops").isLessThanOrEqualTo(previous.ordinal());
            previous = grade;
            counts.merge(grade, 1, Integer::sum);
        }

        assertThat(counts).containsEntry(CreditGrade.A, 201)
                .containsEntry(CreditGrade.B, 100)
                .containsEntry(CreditGrade.C, 100)
                .containsEntry(CreditGrade.D, 100)
                .containsEntry(CreditGrade.F, 500);
    }

    @Test
    void fromScore_outOfRange_throws() {
        assertThatThrownBy(() -> CreditGrade.fromScore(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreditGrade.fromScore(1001)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void creditTerms() {
        assertThat(CreditGrade.A.getInterestRatePct()).isEqualTo(8.0);
        assertThat(CreditGrade.B.getInterestRatePct()).isEqualTo(10.0);
        assertThat(CreditGrade.C.getInterestRatePct()).isEqualTo(12.0);
        assertThat(CreditGrade.D.getInterestRatePct()).isEqualTo(15.0);
        assertThat(CreditGrade.F.getInterestRatePct()).isNull();
        assertThat(CreditGrade.F.isEligible()).isFalse();
        assertThat(CreditGrade.D.isEligible()).isTrue();
    }
}
