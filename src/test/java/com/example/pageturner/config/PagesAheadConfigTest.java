package com.example.pageturner.config;

import com.example.pageturner.Limit;
import com.example.pageturner.async.listener.PagesAheadListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PagesAheadConfigTest {

    @Test
    @DisplayName("Should default to no limit and the no-op listener")
    void shouldApplyDefaults() {
        PagesAheadConfig config = PagesAheadConfig.of(4);

        assertThat(config.requestsAheadCount()).isEqualTo(4);
        assertThat(config.limit()).isEqualTo(Limit.none());
        assertThat(config.listener()).isSameAs(PagesAheadListener.noop());
    }

    @Test
    @DisplayName("Should replace a null listener with the no-op listener")
    void shouldReplaceNullListener() {
        assertThat(new PagesAheadConfig(1, Limit.none(), null).listener()).isSameAs(PagesAheadListener.noop());
    }

    @Test
    @DisplayName("Should reject a negative window and a missing limit")
    void shouldValidate() {
        assertThatThrownBy(() -> PagesAheadConfig.of(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PagesAheadConfig.of(1, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should copy the configuration with another limit")
    void shouldCopyWithLimit() {
        PagesAheadConfig config = PagesAheadConfig.of(4).withLimit(Limit.pages(10));

        assertThat(config.requestsAheadCount()).isEqualTo(4);
        assertThat(config.limit()).isEqualTo(Limit.pages(10));
    }

    @Test
    @DisplayName("Should forward events to both chained listeners")
    void shouldChainListeners() {
        List<String> events = new ArrayList<>();
        PagesAheadListener first = new PagesAheadListener() {
            @Override
            public void onLastPage(long index) {
                events.add("first:" + index);
            }
        };
        PagesAheadListener second = new PagesAheadListener() {
            @Override
            public void onLastPage(long index) {
                events.add("second:" + index);
            }
        };

        PagesAheadConfig config = PagesAheadConfig.of(2).withListener(first.andThen(second));
        config.listener().onLastPage(7);
        config.listener().onScheduled(0, "ignored");

        assertThat(events).containsExactly("first:7", "second:7");
    }
}
