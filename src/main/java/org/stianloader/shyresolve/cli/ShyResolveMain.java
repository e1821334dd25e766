package org.stianloader.shyresolve.cli;

import java.io.PrintStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.AmbiguousCandidatesException;
import org.stianloader.shyresolve.ConfigurationException;
import org.stianloader.shyresolve.ResolvedCandidate;
import org.stianloader.shyresolve.ShyConfiguration;
import org.stianloader.shyresolve.ShyResolver;
import org.stianloader.shyresolve.logging.LoggingAdapter;

/**
 * Command line front end: arbitrates the candidates of a single package given as arguments.
 *
 * <pre>shyresolve &lt;package&gt; &lt;version&gt;@&lt;index-url&gt; [&lt;version&gt;@&lt;index-url&gt; ...]</pre>
 */
public final class ShyResolveMain {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_ABORT = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: shyresolve <package> <version>@<index-url> [<version>@<index-url> ...]";

    public static void main(String[] args) {
        System.exit(ShyResolveMain.run(args, System::getenv, System.out, System.err));
    }

    @NotNull
    static ResolvedCandidate parseCandidate(@NotNull String packageName, @NotNull String argument) {
        int separator = argument.indexOf('@');
        if (separator <= 0 || separator == argument.length() - 1) {
            throw new IllegalArgumentException("Candidate '" + argument + "' is not of the form <version>@<index-url>");
        }
        URI indexURL;
        try {
            indexURL = new URI(argument.substring(separator + 1));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Candidate '" + argument + "' has a malformed index URL: " + e.getMessage(), e);
        }
        return ResolvedCandidate.of(packageName, argument.substring(0, separator), indexURL);
    }

    public static int run(@NotNull String[] args, @NotNull Function<String, String> environment, @NotNull PrintStream out, @NotNull PrintStream err) {
        return ShyResolveMain.run(args, environment, out, err, Clock.systemUTC());
    }

    static int run(@NotNull String[] args, @NotNull Function<String, String> environment, @NotNull PrintStream out, @NotNull PrintStream err, @NotNull Clock clock) {
        ShyConfiguration configuration;
        try {
            configuration = ShyConfiguration.fromEnvironment(environment);
        } catch (ConfigurationException e) {
            err.println("shyresolve: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (configuration.isDumpConfig()) {
            configuration.print(err);
            return EXIT_SUCCESS;
        }

        if (args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String packageName = args[0];
        List<ResolvedCandidate> candidates = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            try {
                candidates.add(ShyResolveMain.parseCandidate(packageName, args[i]));
            } catch (IllegalArgumentException e) {
                err.println("shyresolve: " + e.getMessage());
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }

        ResolvedCandidate selected;
        try {
            selected = new ShyResolver(configuration, clock).select(candidates);
        } catch (AmbiguousCandidatesException e) {
            LoggingAdapter.getDefaultLogger().debug(ShyResolveMain.class, "Refusing to select a candidate for {}", e.getPackageName(), e);
            err.println("shyresolve: " + e.getMessage());
            err.println("shyresolve: refusing to install " + e.getPackageName() + " (" + e.getTrustedCount() + " trusted, "
                    + e.getUntrustedCount() + " untrusted candidate(s)). Set " + ShyConfiguration.ENV_POPULARITY
                    + " or remove one of the sources.");
            return EXIT_ABORT;
        }

        out.println(selected.packageName() + " " + selected.version() + " " + selected.originDomain());
        return EXIT_SUCCESS;
    }

    private ShyResolveMain() {
        throw new AssertionError();
    }
}
