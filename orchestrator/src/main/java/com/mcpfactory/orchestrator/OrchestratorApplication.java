package com.mcpfactory.orchestrator;

import com.mcpfactory.orchestrator.cli.FactoryCommandLine;
import com.mcpfactory.orchestrator.config.FactoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Runs as an HTTP service by default. With {@code --spring.profiles.active=cli}
 * it executes one command and exits with the command's exit code.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run
 *   java -jar orchestrator.jar --spring.profiles.active=cli validate ./output/mcp-weather
 */
@SpringBootApplication
@EnableConfigurationProperties(FactoryProperties.class)
public class OrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    static final String CLI_PROFILE        = "cli";
    static final String STANDALONE_PROFILE = "standalone";

    private static final String PROFILES_OPTION = "--spring.profiles.active=";

    public static void main(String[] args) {
        if (cliRequested(args, System.getenv("SPRING_PROFILES_ACTIVE"))) {
            System.exit(runCli(args, OrchestratorApplication::launch));
        }
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    // ------------------------------------------------------------------
    // Command mode
    // ------------------------------------------------------------------

    /**
     * Start the context, let the command run, and return its exit code.
     * A context that fails to start is an internal error, not a user error.
     */
    static int runCli(String[] args, Function<String[], ConfigurableApplicationContext> launcher) {
        ConfigurableApplicationContext ctx;
        try {
            ctx = launcher.apply(args);
        } catch (RuntimeException e) {
            log.error("Command could not start: {}", e.getMessage());
            return FactoryCommandLine.INTERNAL_ERROR;
        }
        return SpringApplication.exit(ctx);
    }

    /** Same precedence as Spring: command line, then system property, then environment. */
    static boolean cliRequested(String[] args, String envProfiles) {
        String active = System.getProperty("spring.profiles.active", envProfiles);
        for (String arg : args) {
            if (arg.startsWith(PROFILES_OPTION)) {
                active = arg.substring(PROFILES_OPTION.length());
            }
        }
        return active != null
                && Arrays.stream(active.split(",")).map(String::trim).anyMatch(CLI_PROFILE::equals);
    }

    /** True when the command is {@code validate}, which never reads or writes the registry. */
    static boolean needsNoDatabase(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .map("validate"::equals)
                .orElse(false);
    }

    private static ConfigurableApplicationContext launch(String[] args) {
        SpringApplication app = new SpringApplication(OrchestratorApplication.class);
        if (needsNoDatabase(args)) {
            app.setAdditionalProfiles(STANDALONE_PROFILE);
        }
        return app.run(args);
    }
}
