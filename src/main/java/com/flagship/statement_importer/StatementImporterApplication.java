package com.flagship.statement_importer;

import com.flagship.statement_importer.cli.EnvironmentFile;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StatementImporterApplication {

    public static void main(String[] args) {
        System.setProperty("spring.config.import", EnvironmentFile.configImport(args));
        System.exit(SpringApplication.exit(SpringApplication.run(StatementImporterApplication.class, args)));
    }
}
