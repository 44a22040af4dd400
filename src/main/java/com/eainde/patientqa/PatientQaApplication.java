package com.eainde.patientqa;

import com.eainde.patientqa.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class PatientQaApplication {

    private static final Logger log = LoggerFactory.getLogger(PatientQaApplication.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        ConfigurableApplicationContext context;
        try {
            context = SpringApplication.run(PatientQaApplication.class, args);
        } catch (RuntimeException e) {
            return exitCodeFor(e);
        }
        return SpringApplication.exit(context);
    }

    /**
     * Setup failures surface here, wrapped by Spring; a configuration error anywhere
     * in the cause chain maps to {@link AssistantCommandRunner#EXIT_CONFIGURATION}.
     */
    static int exitCodeFor(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConfigurationException ce) {
                log.error("Configuration error: {}", ce.getMessage());
                return AssistantCommandRunner.EXIT_CONFIGURATION;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        log.error("Startup failed", failure);
        return AssistantCommandRunner.EXIT_FAILURE;
    }
}
