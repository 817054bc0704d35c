package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.core.exception.ChannelException;
import com.ryuqq.ingest.core.exception.NoMessageAvailableException;
import com.ryuqq.ingest.core.spi.ChannelConsumer;
import com.ryuqq.ingest.core.spi.ChannelMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * StreamReader 유닛 테스트.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StreamReaderTest {

    private static final Duration WAIT = Duration.ofMillis(20);

    @Mock
    private ChannelConsumer consumer;

    @Mock
    private ChannelMessage message;

    private PendingAcks pendingAcks;
    private StreamReader reader;

    @BeforeEach
    void setUp() {
        pendingAcks = new PendingAcks(10);
        reader = new StreamReader(consumer, pendingAcks, WAIT);
    }

    private static NoMessageAvailableException timeout() {
        return new NoMessageAvailableException("elasticsearch", WAIT);
    }

    @Test
    void next는_타임아웃을_건너뛰고_메시지를_반환() {
        // given
        when(consumer.pull(WAIT)).thenThrow(timeout()).thenThrow(timeout()).thenReturn(message);

        // when
        ChannelMessage next = reader.next();

        // then
        assertThat(next).isSameAs(message);
        verify(consumer, times(3)).pull(WAIT);
    }

    @Test
    void 반환한_메시지는_PendingAcks에_추가됨() {
        // given
        when(consumer.pull(WAIT)).thenReturn(message);

        // when
        reader.next();

        // then
        assertThat(pendingAcks.size()).isEqualTo(1);
        assertThat(pendingAcks.popHead(message)).isSameAs(message);
    }

    @Test
    void poll은_타임아웃이면_empty() {
        // given
        when(consumer.pull(WAIT)).thenThrow(timeout());

        // when & then
        assertThat(reader.poll()).isEmpty();
        assertThat(pendingAcks.isEmpty()).isTrue();
    }

    @Test
    void ChannelException은_그대로_전파됨() {
        // given
        when(consumer.pull(WAIT)).thenThrow(new ChannelException("connection reset"));

        // when & then
        assertThatThrownBy(reader::next).isInstanceOf(ChannelException.class);
        assertThat(pendingAcks.isEmpty()).isTrue();
    }

    @Test
    void 닫힌_reader는_hasNext가_false이고_next는_예외() {
        // when
        reader.close();

        // then
        assertThat(reader.hasNext()).isFalse();
        assertThatThrownBy(reader::next).isInstanceOf(NoSuchElementException.class);
        verifyNoInteractions(consumer);
    }

    @Test
    void 대기_중_닫히면_현재_pull_이후_종료() {
        // given
        when(consumer.pull(WAIT)).thenAnswer(invocation -> {
            reader.close();
            throw timeout();
        });

        // when & then
        assertThatThrownBy(reader::next).isInstanceOf(NoSuchElementException.class);
        verify(consumer, times(1)).pull(WAIT);
    }

    @Test
    void waitTimeout이_0이면_예외() {
        assertThatThrownBy(() -> new StreamReader(consumer, pendingAcks, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("waitTimeout");
    }
}
