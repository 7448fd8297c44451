package com.di.phenostore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Wide-table subject store. The data source is built from {@code phenostore.datasource}
 * by {@link com.di.phenostore.config.DataSourceConfig}, so Boot's own data source
 * auto-configuration is switched off.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class PhenoStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(PhenoStoreApplication.class, args);
	}
}
