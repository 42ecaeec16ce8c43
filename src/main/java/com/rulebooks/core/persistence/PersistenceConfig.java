package com.rulebooks.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulebooks.core.importer.ImporterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} providing the project repository and the
 * archive blob storage.
 * <p>
 * The project tables are created on startup unless
 * {@code rulebooks.storage.initialize-schema} is {@code false}.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public JdbcProjectRepository projectRepository(DataSource dataSource,
                                                   ObjectProvider<ObjectMapper> objectMapper,
                                                   ImporterProperties properties) {
        var repository = new JdbcProjectRepository(dataSource, objectMapper.getIfAvailable(ObjectMapper::new));
        if (properties.isInitializeSchema()) {
            repository.createTables();
        } else {
            log.info("Schema initialisation disabled; expecting project tables to exist");
        }
        return repository;
    }

    @Bean
    public FileSystemArchiveStorage archiveStorage(ImporterProperties properties) {
        var storage = new FileSystemArchiveStorage(Path.of(properties.getArchiveDir()));
        log.info("Storing project archives in {}", storage.root());
        return storage;
    }
}
