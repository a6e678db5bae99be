package de.bsommerfeld.crashscope.installer.env;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads the process environment to decide whether automatic installation may
 * run at all and whether privileged commands must be suppressed.
 *
 * <p>
 * CI detection only knows the variables in {@link #CI_VARIABLES}. Unknown CI
 * systems are treated as interactive hosts; that false negative is accepted.
 */
@Singleton
public class EnvironmentProbe {

    public static final String DISABLE_VARIABLE = "CRASHSCOPE_NO_AUTO_INSTALL";

    static final List<String> CI_VARIABLES = List.of(
            "CI",
            "CONTINUOUS_INTEGRATION",
            "GITHUB_ACTIONS",
            "GITLAB_CI",
            "JENKINS_URL",
            "BUILDKITE",
            "CIRCLECI",
            "TRAVIS",
            "TF_BUILD",
            "TEAMCITY_VERSION",
            "BITBUCKET_BUILD_NUMBER");

    private static final List<String> FALSE_VALUES = List.of("0", "false", "no", "off");

    private final Function<String, String> env;

    @Inject
    public EnvironmentProbe() {
        this(System::getenv);
    }

    public EnvironmentProbe(Function<String, String> env) {
        this.env = Objects.requireNonNull(env);
    }

    /**
     * @return {@code true} if {@link #DISABLE_VARIABLE} is set to anything but
     *         an explicit false value
     */
    public boolean isAutoInstallDisabled() {
        String value = env.apply(DISABLE_VARIABLE);
        if (value == null || value.isBlank()) {
            return false;
        }
        return !FALSE_VALUES.contains(value.strip().toLowerCase(Locale.ROOT));
    }

    public boolean isCiEnvironment() {
        for (String variable : CI_VARIABLES) {
            String value = env.apply(variable);
            if (value != null && !value.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
