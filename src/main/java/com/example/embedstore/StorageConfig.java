package com.example.embedstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Value("${store.path:./data/embeddings.raptor}")
    private String storePath;

    @Value("${store.chunk-size:65536}")
    private int chunkSize;

    /**
     * The provider bean is lazy, so the model is only started when the engine
     * first needs an embedding.
     */
    @Bean(destroyMethod = "dispose")
    public StorageEngine storageEngine(ObjectProvider<EmbeddingService> embeddingServices) {
        Path p = Path.of(storePath);
        log.info("Using embedding store {} (chunk size {} bytes)", p.toAbsolutePath(), chunkSize);
        return new StorageEngine(p, chunkSize, embeddingServices::getObject);
    }
}
