package com.tenantseed.config;

import com.tenantseed.model.SeedEnvironment;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Seeder settings. Bound from application.yml under 'tenantseed'; the environment can also be
 * chosen with {@code --tenantseed.environment=prod} or the SEED_ENV variable.
 */
@Configuration
@ConfigurationProperties(prefix = "tenantseed")
public class SeedProperties {

    private String environment = "dev";
    private Resource devCatalogue;
    private Resource prodCatalogue;
    private Resource titleDefinitions;
    private int bcryptStrength = 12;
    private boolean runOnStartup = true;

    public SeedEnvironment resolveEnvironment() {
        return SeedEnvironment.fromSelector(environment);
    }

    public Resource catalogueFor(SeedEnvironment env) {
        return env == SeedEnvironment.PROD ? prodCatalogue : devCatalogue;
    }

    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }

    public Resource getDevCatalogue() { return devCatalogue; }
    public void setDevCatalogue(Resource devCatalogue) { this.devCatalogue = devCatalogue; }

    public Resource getProdCatalogue() { return prodCatalogue; }
    public void setProdCatalogue(Resource prodCatalogue) { this.prodCatalogue = prodCatalogue; }

    public Resource getTitleDefinitions() { return titleDefinitions; }
    public void setTitleDefinitions(Resource titleDefinitions) { this.titleDefinitions = titleDefinitions; }

    public int getBcryptStrength() { return bcryptStrength; }
    public void setBcryptStrength(int bcryptStrength) { this.bcryptStrength = bcryptStrength; }

    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
}
