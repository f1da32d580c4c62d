package com.billing.leakdetector.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionTypeTest {

    @Test
    void parse_acceptsUnderscoreHyphenAndUpperCaseSpellings() {
        assertThat(ActionType.parse("mark_reviewed")).isEqualTo(ActionType.MARK_REVIEWED);
        assertThat(ActionType.parse("mark-reviewed")).isEqualTo(ActionType.MARK_REVIEWED);
        assertThat(ActionType.parse(" CREATE-WORK-ORDER ")).isEqualTo(ActionType.CREATE_WORK_ORDER);
        assertThat(ActionType.parse("export")).isEqualTo(ActionType.EXPORT);
    }

    @Test
    void parse_isIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(ActionType.parse("mark_reviewed")).isEqualTo(ActionType.MARK_REVIEWED);
            assertThat(ActionType.parse("create_work_order")).isEqualTo(ActionType.CREATE_WORK_ORDER);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void parse_unknownOrBlank_isRejected() {
        assertThatThrownBy(() -> ActionType.parse("escalate"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("escalate");
        assertThatThrownBy(() -> ActionType.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void impliedStatus_followsActionKind() {
        assertThat(ActionType.MARK_REVIEWED.impliedStatus()).contains(ReviewStatus.REVIEWED);
        assertThat(ActionType.CREATE_WORK_ORDER.impliedStatus()).contains(ReviewStatus.ACTIONED);
        assertThat(ActionType.EXPORT.impliedStatus()).isEmpty();
    }
}
