package com.tenantseed.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantseed.config.SeedProperties;
import com.tenantseed.exception.CatalogueLoadException;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.fixture.SeedCatalogue;
import com.tenantseed.model.fixture.TitleDefinitionFixture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the fixture catalogues from JSON resources.
 */
@Component
public class FixtureCatalogueLoader {

    private static final Logger log = LoggerFactory.getLogger(FixtureCatalogueLoader.class);

    private final ObjectMapper objectMapper;
    private final SeedProperties properties;

    public FixtureCatalogueLoader(ObjectMapper objectMapper, SeedProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public SeedCatalogue loadCatalogue(SeedEnvironment env) {
        return loadCatalogue(properties.catalogueFor(env));
    }

    public SeedCatalogue loadCatalogue(Resource resource) {
        SeedCatalogue catalogue = read(resource, new TypeReference<SeedCatalogue>() {});
        log.info("Loaded catalogue {}: {} tenants, {} marketplace users", resource.getDescription(),
            catalogue.tenants().size(), catalogue.marketplaceUsers().size());
        return catalogue;
    }

    public List<TitleDefinitionFixture> loadTitleDefinitions() {
        return loadTitleDefinitions(properties.getTitleDefinitions());
    }

    public List<TitleDefinitionFixture> loadTitleDefinitions(Resource resource) {
        List<TitleDefinitionFixture> definitions = read(resource, new TypeReference<List<TitleDefinitionFixture>>() {});
        log.info("Loaded {} title definitions", definitions.size());
        return definitions;
    }

    private <T> T read(Resource resource, TypeReference<T> type) {
        if (resource == null || !resource.exists()) {
            throw new CatalogueLoadException("Fixture resource not found: "
                + (resource == null ? "(not configured)" : resource.getDescription()), null);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new CatalogueLoadException("Failed to read fixtures from " + resource.getDescription(), e);
        }
    }
}
