package org.huang.origin.registry;

import org.huang.origin.registry.config.RegistryConfig;
import org.huang.origin.registry.config.RegistryStrategies;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class AppTest {
    static final Logger log = LoggerFactory.getLogger(AppTest.class);

    static final RegistryStrategies STRATEGIES =
            RegistryStrategies.create(RegistryConfig.builder().routerSubdomain("apps.example.com").build());

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void testCreateRoute() throws IOException {
        Path file = write("route.yaml",
                "apiVersion: route.openshift.io/v1\n"
                        + "kind: Route\n"
                        + "metadata:\n"
                        + "  name: frontend\n"
                        + "  namespace: demo\n"
                        + "spec:\n"
                        + "  to:\n"
                        + "    kind: Service\n"
                        + "    name: frontend\n"
                        + "status:\n"
                        + "  ingress:\n"
                        + "  - host: spoofed.example.com\n"
                        + "    routerName: default\n");

        int code = run("create", "route", file.toString());
        log.debug("output:\n{}", out);

        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(stdout())
                .contains("frontend-demo.apps.example.com")
                .contains("openshift.io/host.generated")
                .doesNotContain("spoofed.example.com");
    }

    @Test
    void testCreateBuildConfigDropsUnknownTriggers() throws IOException {
        Path file = write("bc.yaml",
                "apiVersion: build.openshift.io/v1\n"
                        + "kind: BuildConfig\n"
                        + "metadata:\n"
                        + "  name: ruby-sample\n"
                        + "  namespace: demo\n"
                        + "spec:\n"
                        + "  triggers:\n"
                        + "  - type: ConfigChange\n"
                        + "  - type: BogusType\n");

        int code = run("create", "buildconfig", file.toString());

        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(stdout()).contains("ConfigChange").doesNotContain("BogusType");
    }

    @Test
    void testUpdateRouteKeepsHost() throws IOException {
        Path old = write("old.yaml",
                "apiVersion: route.openshift.io/v1\n"
                        + "kind: Route\n"
                        + "metadata:\n"
                        + "  name: frontend\n"
                        + "  namespace: demo\n"
                        + "spec:\n"
                        + "  host: foo.example.com\n"
                        + "  to:\n"
                        + "    name: frontend\n");
        Path updated = write("new.yaml",
                "apiVersion: route.openshift.io/v1\n"
                        + "kind: Route\n"
                        + "metadata:\n"
                        + "  name: frontend\n"
                        + "  namespace: demo\n"
                        + "spec:\n"
                        + "  path: /shop\n"
                        + "  to:\n"
                        + "    name: frontend\n");

        int code = run("update", "route", old.toString(), updated.toString());

        assertThat(code).isEqualTo(App.EXIT_OK);
        assertThat(stdout()).contains("foo.example.com").contains("/shop");
    }

    @Test
    void testInvalidRouteReportsErrors() throws IOException {
        Path file = write("route.yaml",
                "apiVersion: route.openshift.io/v1\n"
                        + "kind: Route\n"
                        + "metadata:\n"
                        + "  name: frontend\n"
                        + "  namespace: demo\n"
                        + "spec:\n"
                        + "  host: www.example.com\n");

        int code = run("create", "route", file.toString());

        assertThat(code).isEqualTo(App.EXIT_INVALID);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("spec.to: Required value");
    }

    @Test
    void testUsage() {
        assertThat(run("delete", "route", "x.yaml")).isEqualTo(App.EXIT_USAGE);
        assertThat(run("update-status", "buildconfig", "a.yaml", "b.yaml")).isEqualTo(App.EXIT_USAGE);
        assertThat(run("create", "route", dir.resolve("missing.yaml").toString())).isEqualTo(App.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("usage:");
    }

    private int run(String... args) {
        return App.run(args, STRATEGIES,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
