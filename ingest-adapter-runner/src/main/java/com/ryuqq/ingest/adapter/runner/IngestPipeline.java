package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.application.bootstrap.ChannelBootstrap;
import com.ryuqq.ingest.application.config.ChannelConfig;
import com.ryuqq.ingest.application.config.PublisherConfig;
import com.ryuqq.ingest.application.publisher.DocumentPublisher;
import com.ryuqq.ingest.core.codec.ActionCodec;
import com.ryuqq.ingest.core.spi.DurableChannel;
import com.ryuqq.ingest.core.spi.SearchBackend;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 적재 파이프라인 조립 지점.
 *
 * <p>채널 선언, 발행기, worker pool을 하나로 묶습니다. 채널과 백엔드 구현은
 * 호출자가 주입합니다 (운영: 브로커/OpenSearch 어댑터, 테스트: in-memory 어댑터).</p>
 *
 * <pre>
 * IngestPipeline pipeline = IngestPipeline.fromConfig(IngestConfigLoader.load(), channel, backend);
 * pipeline.start();
 * pipeline.publishTask().run("acme", "login", document);
 * pipeline.stop();
 * </pre>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class IngestPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestPipeline.class);

    private final DurableChannel channel;
    private final ChannelBootstrap bootstrap;
    private final DocumentPublisher publisher;
    private final PublishTask publishTask;
    private final WorkerPoolSupervisor supervisor;

    /**
     * @param channel 채널 (이름은 channelConfig와 일치해야 함)
     * @param backend 검색 백엔드
     * @param codec action codec
     * @param channelConfig 채널 설정
     * @param publisherConfig 발행 설정
     * @param retryConfig 발행 재시도 설정
     * @param flusherConfig flusher 설정
     * @param workerPoolConfig worker pool 설정
     */
    public IngestPipeline(DurableChannel channel,
                          SearchBackend backend,
                          ActionCodec codec,
                          ChannelConfig channelConfig,
                          PublisherConfig publisherConfig,
                          PublishRetryConfig retryConfig,
                          FlusherConfig flusherConfig,
                          WorkerPoolConfig workerPoolConfig) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (channelConfig == null) {
            throw new IllegalArgumentException("channelConfig cannot be null");
        }
        if (flusherConfig == null) {
            throw new IllegalArgumentException("flusherConfig cannot be null");
        }
        if (!channel.name().equals(channelConfig.name())) {
            throw new IllegalArgumentException("channel name '" + channel.name()
                + "' does not match configured name '" + channelConfig.name() + "'");
        }

        this.channel = channel;
        this.bootstrap = new ChannelBootstrap(channel, channelConfig.declarationFailurePolicy());
        this.publisher = new DocumentPublisher(channel, codec, publisherConfig);
        this.publishTask = new PublishTask(publisher, retryConfig);
        this.supervisor = new WorkerPoolSupervisor(
            () -> new BatchFlusher(channel, backend, flusherConfig),
            workerPoolConfig
        );
    }

    /**
     * 해석된 설정에서 조립합니다.
     *
     * @param config {@link com.ryuqq.ingest.application.config.IngestConfigLoader}로 읽은 설정
     * @param channel 채널
     * @param backend 검색 백엔드
     * @return 파이프라인 (아직 시작 전)
     */
    public static IngestPipeline fromConfig(Config config, DurableChannel channel, SearchBackend backend) {
        return new IngestPipeline(
            channel,
            backend,
            new ActionCodec(),
            ChannelConfig.fromConfig(config),
            PublisherConfig.fromConfig(config),
            PublishRetryConfig.fromConfig(config),
            FlusherConfig.fromConfig(config),
            WorkerPoolConfig.fromConfig(config)
        );
    }

    /**
     * 채널을 선언하고 worker를 띄웁니다.
     *
     * @return 채널 선언 성공 여부 (DEGRADE 정책에서 false일 수 있음)
     * @throws com.ryuqq.ingest.core.exception.ChannelDeclarationException FAIL_FAST 정책에서 선언 실패 시
     */
    public boolean start() {
        boolean declared = bootstrap.declare();
        supervisor.start();
        log.info("Ingest pipeline on channel '{}' started (declared: {})", channel.name(), declared);
        return declared;
    }

    /**
     * @param concurrency worker 수
     * @return 채널 선언 성공 여부
     */
    public boolean start(int concurrency) {
        boolean declared = bootstrap.declare();
        supervisor.start(concurrency);
        log.info("Ingest pipeline on channel '{}' started with {} workers (declared: {})",
            channel.name(), concurrency, declared);
        return declared;
    }

    public boolean stop() {
        return supervisor.stop();
    }

    public boolean stop(Duration timeout) {
        return supervisor.stop(timeout);
    }

    public DocumentPublisher publisher() {
        return publisher;
    }

    public PublishTask publishTask() {
        return publishTask;
    }

    public WorkerPoolSupervisor supervisor() {
        return supervisor;
    }
}
