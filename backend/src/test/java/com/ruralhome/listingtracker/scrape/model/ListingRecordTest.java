package com.ruralhome.listingtracker.scrape.model;

import com.ruralhome.listingtracker.scrape.support.ListingFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingRecordTest {

    @Test
    void flagsMustAgreeWithMentions() {
        assertThatThrownBy(() -> listing(true, List.of(), false, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("septic");
        assertThatThrownBy(() -> listing(false, List.of(), false, List.of("utilities: Private Well")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("well");
    }

    @Test
    void nullMentionsMeanNoMatch() {
        ListingRecord record = listing(false, null, false, null);

        assertThat(record.septicMentions()).isEmpty();
        assertThat(record.wellMentions()).isEmpty();
        assertThat(record.hasAnyMatch()).isFalse();
    }

    @Test
    void withAgentKeepsClassification() {
        ListingRecord record = ListingFixtures.listing("W1", true, true)
            .withAgent("https://www.realtor.com/realestateagents/x", "Kim Hollis", "4145550123");

        assertThat(record.hasSepticSystem()).isTrue();
        assertThat(record.wellMentions()).containsExactly("utilities: Private Well");
        assertThat(record.agentName()).isEqualTo("Kim Hollis");
    }

    private ListingRecord listing(boolean septic, List<String> septicMentions, boolean well, List<String> wellMentions) {
        Instant now = Instant.now();
        return new ListingRecord(
            ListingFixtures.BASE_URL + "perma-R1",
            "R1",
            "1 Road",
            "Salem",
            "Kenosha",
            "WI",
            "53168",
            100000L,
            null,
            null,
            null,
            null,
            septic,
            well,
            septicMentions,
            wellMentions,
            null,
            null,
            null,
            null,
            now,
            now,
            1,
            now
        );
    }
}
