package com.tencent.scanflow.infrastructure.config;

import com.tencent.scanflow.domain.state.RunStateRepository;
import com.tencent.scanflow.domain.store.ArtifactStore;
import com.tencent.scanflow.infrastructure.filesystem.FilesystemArtifactStore;
import com.tencent.scanflow.infrastructure.filesystem.FilesystemRunStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * FilesystemStoreConfig - scanflow.store.type=filesystem 时的存储装配
 *
 * @author scanflow
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "scanflow.store", name = "type", havingValue = "filesystem")
public class FilesystemStoreConfig {

    @Bean
    public ArtifactStore filesystemArtifactStore(@Value("${scanflow.store.base-path:.scanflow}") String basePath) {
        Path base = Paths.get(basePath).toAbsolutePath().normalize();
        log.info("Using filesystem artifact store at {}", base);
        return new FilesystemArtifactStore(base);
    }

    @Bean
    public RunStateRepository filesystemRunStateRepository(@Value("${scanflow.store.base-path:.scanflow}") String basePath) {
        return new FilesystemRunStateRepository(Paths.get(basePath).toAbsolutePath().normalize());
    }
}
