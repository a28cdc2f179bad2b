package com.tenantseed.service.builder;

import com.tenantseed.model.DraftChannel;
import com.tenantseed.model.fixture.DraftFixture;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DraftBuilderTest {

    private static final String TONIGHT = "Remember to close the gate before the hounds get out tonight.";
    private static final String TOMORROW = "Remember to close the gate before the hounds get out tomorrow.";

    @Test
    void subjectlessDraftsAreKeyedByBody() {
        String first = DraftBuilder.naturalKey(new DraftFixture(null, DraftChannel.DM, null, "Short note", 1));
        String second = DraftBuilder.naturalKey(new DraftFixture(null, DraftChannel.DM, null, "Other note", 1));

        assertThat(first).isEqualTo("(no subject) / Short note");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void longBodiesSharingAPrefixGetDistinctKeys() {
        String tonight = DraftBuilder.naturalKey(new DraftFixture(null, DraftChannel.DM, null, TONIGHT, 1));
        String tomorrow = DraftBuilder.naturalKey(new DraftFixture(null, DraftChannel.DM, null, TOMORROW, 1));

        assertThat(tonight).startsWith("(no subject) / " + TONIGHT.substring(0, DraftBuilder.KEY_BODY_LENGTH) + "...");
        assertThat(tonight).isNotEqualTo(tomorrow);
    }

    @Test
    void keyIgnoresChannelAndRecipient() {
        String dm = DraftBuilder.naturalKey(new DraftFixture(0, DraftChannel.DM, "Hello", TONIGHT, 1));
        String email = DraftBuilder.naturalKey(new DraftFixture(null, DraftChannel.EMAIL, "Hello", TONIGHT, 3));

        assertThat(dm).isEqualTo(email);
    }
}
