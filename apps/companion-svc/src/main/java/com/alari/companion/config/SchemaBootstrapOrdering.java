package com.alari.companion.config;

import org.springframework.boot.autoconfigure.orm.jpa.EntityManagerFactoryDependsOnPostProcessor;
import org.springframework.stereotype.Component;

/**
 * Schema bootstrap must finish before Hibernate validates the mappings.
 */
@Component
class SchemaBootstrapOrdering extends EntityManagerFactoryDependsOnPostProcessor {

    SchemaBootstrapOrdering() {
        super(DatabaseBootstrap.class);
    }
}
