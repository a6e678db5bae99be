package de.bsommerfeld.crashscope.installer.pkg;

import de.bsommerfeld.crashscope.installer.env.Platform;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Package managers the installer can drive, each with the non-interactive
 * argv template used to install a single package.
 */
public enum PackageManager {

    HOMEBREW("brew", "brew", false, List.of("install")),
    APT("apt", "apt-get", true, List.of("install", "-y")),
    DNF("dnf", "dnf", true, List.of("install", "-y")),
    PACMAN("pacman", "pacman", true, List.of("-S", "--noconfirm", "--needed")),
    ZYPPER("zypper", "zypper", true, List.of("--non-interactive", "install")),
    WINGET("winget", "winget", false,
            List.of("install", "--silent", "--accept-package-agreements", "--accept-source-agreements", "--id")),
    CHOCOLATEY("choco", "choco", false, List.of("install", "-y"));

    /** Prepended to privileged commands; {@code -n} makes sudo fail instead of prompting. */
    static final List<String> PRIVILEGE_PREFIX = List.of("sudo", "-n");

    private final String id;
    private final String executable;
    private final boolean requiresPrivilege;
    private final List<String> installArgs;

    PackageManager(String id, String executable, boolean requiresPrivilege, List<String> installArgs) {
        this.id = id;
        this.executable = executable;
        this.requiresPrivilege = requiresPrivilege;
        this.installArgs = installArgs;
    }

    public String id() {
        return id;
    }

    public String executable() {
        return executable;
    }

    public boolean requiresPrivilege() {
        return requiresPrivilege;
    }

    /**
     * Builds the argv that installs {@code packageName}, e.g.
     * {@code [sudo, -n, apt-get, install, -y, radare2]}.
     */
    public List<String> installCommand(String packageName, boolean privileged) {
        List<String> command = new ArrayList<>();
        if (privileged) {
            command.addAll(PRIVILEGE_PREFIX);
        }
        command.add(executable);
        command.addAll(installArgs);
        command.add(packageName);
        return command;
    }

    /**
     * Looks a manager up by its id ({@code apt}), its executable
     * ({@code apt-get}) or its constant name ({@code APT}), ignoring case.
     */
    public static Optional<PackageManager> byId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.strip().toLowerCase(Locale.ROOT);
        for (PackageManager manager : values()) {
            if (manager.id.equals(key) || manager.executable.equals(key)
                    || manager.name().toLowerCase(Locale.ROOT).equals(key)) {
                return Optional.of(manager);
            }
        }
        return Optional.empty();
    }

    /**
     * Managers worth probing on {@code platform}, most preferred first.
     * Empty for {@link Platform#UNSUPPORTED}.
     */
    public static List<PackageManager> candidatesFor(Platform platform) {
        switch (platform) {
            case MACOS:
                return List.of(HOMEBREW);
            case LINUX:
                return List.of(APT, DNF, PACMAN, ZYPPER, HOMEBREW);
            case WINDOWS:
                return List.of(WINGET, CHOCOLATEY);
            default:
                return List.of();
        }
    }
}
