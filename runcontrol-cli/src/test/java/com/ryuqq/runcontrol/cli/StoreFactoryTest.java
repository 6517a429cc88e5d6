package com.ryuqq.runcontrol.cli;

import com.ryuqq.runcontrol.adapter.file.FileControlStore;
import com.ryuqq.runcontrol.adapter.file.FileStoreConfig;
import com.ryuqq.runcontrol.adapter.redis.RedisStoreConfig;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StoreFactory 테스트.
 *
 * <p>명령행 옵션이 백엔드 설정 레코드로 올바르게 옮겨지는지 검증합니다.
 * Redis 연결은 열지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StoreFactoryTest {

    private final StoreFactory factory = new StoreFactory();

    private StoreOptions parse(String... args) {
        RunCtlCommand command = new RunCtlCommand();
        RunCtlCommand.newCommandLine(command).parseArgs(args);
        return command.storeOptions;
    }

    @Test
    void redis_옵션_매핑() {
        StoreOptions options = parse(
            "--store=redis",
            "--redis-host=cache.internal",
            "--redis-port=6380",
            "--redis-username=runner",
            "--redis-password=s3cret",
            "--redis-ssl",
            "--redis-database=2",
            "--redis-prefix=jobs",
            "--poll-interval-ms=250"
        );

        RedisStoreConfig config = factory.redisConfig(options);

        assertThat(options.storeType).isEqualTo(StoreType.REDIS);
        assertThat(config.host()).isEqualTo("cache.internal");
        assertThat(config.port()).isEqualTo(6380);
        assertThat(config.username()).isEqualTo("runner");
        assertThat(config.password()).isEqualTo("s3cret");
        assertThat(config.ssl()).isTrue();
        assertThat(config.database()).isEqualTo(2);
        assertThat(config.keyPrefix()).isEqualTo("jobs");
        assertThat(config.pollIntervalMs()).isEqualTo(250);
        assertThat(config.toString()).doesNotContain("s3cret");
    }

    @Test
    void file_옵션_매핑(@TempDir Path dir) {
        StoreOptions options = parse("--store=FILE", "--dir=" + dir, "--poll-interval-ms=50");

        FileStoreConfig config = factory.fileConfig(options);

        assertThat(config.directory()).isEqualTo(dir);
        assertThat(config.pollIntervalMs()).isEqualTo(50);
    }

    @Test
    void open_파일_스토어(@TempDir Path dir) {
        StoreOptions options = parse("--store=file", "--dir=" + dir);

        try (ControlStore store = factory.open(options)) {
            assertThat(store).isInstanceOf(FileControlStore.class);
            assertThat(((FileControlStore) store).getDirectory()).isEqualTo(dir.toAbsolutePath().normalize());
        }
    }

    @Test
    void 잘못된_폴링_간격_거부() {
        StoreOptions options = parse("--store=file", "--poll-interval-ms=0");

        assertThatThrownBy(() -> factory.fileConfig(options))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollIntervalMs must be positive");
    }

    @Test
    void 알수없는_백엔드는_사용법_오류() {
        RunCtlCommand command = new RunCtlCommand();

        assertThatThrownBy(() -> RunCtlCommand.newCommandLine(command).parseArgs("--store=etcd"))
            .isInstanceOf(CommandLine.ParameterException.class);
    }

    @Test
    void null_옵션_거부() {
        assertThatThrownBy(() -> factory.open(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("options cannot be null");
    }
}
