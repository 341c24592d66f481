package org.huang.origin.registry;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.utils.Serialization;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.registry.config.RegistryConfig;
import org.huang.origin.registry.config.RegistryStrategies;
import org.huang.origin.registry.rest.LifecycleHooks;
import org.huang.origin.registry.rest.LifecycleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 本地演练创建 / 更新流程：读取 yaml，依次执行策略钩子，输出持久化前的对象或者校验错误。
 * <pre>
 *   create        buildconfig|route &lt;file&gt;
 *   update        buildconfig|route &lt;old-file&gt; &lt;new-file&gt;
 *   update-status route &lt;old-file&gt; &lt;new-file&gt;
 * </pre>
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        RegistryStrategies strategies = RegistryStrategies.create(RegistryConfig.fromEnvironment());
        System.exit(run(args, strategies, System.out, System.err));
    }

    static int run(String[] args, RegistryStrategies strategies, PrintStream out, PrintStream err) {
        if (args.length < 3) {
            printUsage(err);
            return EXIT_USAGE;
        }
        String command = args[0];
        LifecycleStrategy<? extends HasMetadata> strategy = selectStrategy(command, args[1], strategies);
        if (strategy == null) {
            printUsage(err);
            return EXIT_USAGE;
        }
        try {
            HasMetadata result;
            List<FieldError> errors;
            if ("create".equals(command)) {
                result = read(Path.of(args[2]), strategy);
                errors = LifecycleHooks.beforeCreate(strategy, result);
            } else {
                if (args.length < 4) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                HasMetadata old = read(Path.of(args[2]), strategy);
                result = read(Path.of(args[3]), strategy);
                errors = LifecycleHooks.beforeUpdate(strategy, result, old);
            }
            if (!errors.isEmpty()) {
                err.println(result.getKind() + " \"" + result.getMetadata().getName() + "\" is invalid:");
                errors.forEach(e -> err.println("  " + e.getMessage()));
                return EXIT_INVALID;
            }
            out.print(Serialization.asYaml(result));
            return EXIT_OK;
        } catch (IOException e) {
            log.error("failed to read resource file", e);
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    static LifecycleStrategy<? extends HasMetadata> selectStrategy(String command, String kind,
                                                                   RegistryStrategies strategies) {
        switch (command) {
            case "create":
            case "update":
                if ("buildconfig".equalsIgnoreCase(kind)) {
                    return strategies.getBuildConfigStrategy();
                }
                if ("route".equalsIgnoreCase(kind)) {
                    return strategies.getRouteStrategy();
                }
                return null;
            case "update-status":
                return "route".equalsIgnoreCase(kind) ? strategies.getRouteStatusStrategy() : null;
            default:
                return null;
        }
    }

    private static HasMetadata read(Path file, LifecycleStrategy<? extends HasMetadata> strategy)
            throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return Serialization.unmarshal(in, strategy.resourceType());
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("usage:");
        err.println("  create        buildconfig|route <file>");
        err.println("  update        buildconfig|route <old-file> <new-file>");
        err.println("  update-status route <old-file> <new-file>");
    }
}
