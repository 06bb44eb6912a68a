package com.chronoplan;

import org.springframework.boot.Banner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Chronoplan runs one portfolio command and exits, or with {@code serve} keeps the
 * schedule REST API up. Only the latter starts a servlet container.
 */
@SpringBootApplication
public class ChronoplanApplication {

    public static void main(String[] args) {
        boolean serve = isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(ChronoplanApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .run(args);

        if (!serve) {
            // The command has already run inside CliRunner; propagate its exit code
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }

    /** True when the arguments select the REST server instead of a one-shot command. */
    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }
}
