package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.core.spi.ChannelMessage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * PendingAcks 테스트.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class PendingAcksTest {

    private static ChannelMessage message(long tag) {
        ChannelMessage message = mock(ChannelMessage.class);
        when(message.deliveryTag()).thenReturn(tag);
        return message;
    }

    @Test
    void 추가한_순서대로_꺼냄() {
        // given
        PendingAcks pending = new PendingAcks(3);
        ChannelMessage first = message(1);
        ChannelMessage second = message(2);
        pending.append(first);
        pending.append(second);

        // when & then
        assertThat(pending.popHead(first)).isSameAs(first);
        assertThat(pending.popHead(second)).isSameAs(second);
        assertThat(pending.isEmpty()).isTrue();
    }

    @Test
    void 맨_앞이_아닌_메시지를_꺼내면_예외() {
        // given
        PendingAcks pending = new PendingAcks(3);
        ChannelMessage first = message(1);
        ChannelMessage second = message(2);
        pending.append(first);
        pending.append(second);

        // when & then
        assertThatThrownBy(() -> pending.popHead(second))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("does not match");
        assertThat(pending.size()).isEqualTo(2);
    }

    @Test
    void 비어_있을_때_꺼내면_예외() {
        PendingAcks pending = new PendingAcks(1);

        assertThatThrownBy(() -> pending.popHead(message(7)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("7");
    }

    @Test
    void capacity를_넘으면_예외() {
        // given
        PendingAcks pending = new PendingAcks(1);
        pending.append(message(1));

        // when & then
        assertThatThrownBy(() -> pending.append(message(2)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("capacity");
    }

    @Test
    void discard는_모두_버리고_개수를_반환() {
        // given
        PendingAcks pending = new PendingAcks(5);
        pending.append(message(1));
        pending.append(message(2));

        // when
        int discarded = pending.discard();

        // then
        assertThat(discarded).isEqualTo(2);
        assertThat(pending.isEmpty()).isTrue();
    }

    @Test
    void capacity가_0이면_예외() {
        assertThatThrownBy(() -> new PendingAcks(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
