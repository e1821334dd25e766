package org.stianloader.shyresolve.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A version string ordered according to the version scheme of python packages (PEP 440), as used by pip.
 *
 * <p>A version consists of an optional epoch, a release segment, and optional pre-release, post-release,
 * development release and local segments: {@code [N!]N(.N)*[{a|b|rc}N][.postN][.devN][+local]}.
 * The usual alternative spellings ("alpha", "c", "preview", "rev", "-1" and so on, with '.', '-' or '_'
 * as separators) are normalized before comparison. The resulting order is
 * {@code 1.0.dev1 < 1.0a1.dev1 < 1.0a1 < 1.0b1 < 1.0rc1 < 1.0 < 1.0+local < 1.0.post1.dev1 < 1.0.post1}.
 *
 * <p>Strings which are not valid under the scheme are still accepted, but sort before every valid version
 * and only compare lexically among each other. Such versions are therefore never newer than a valid one.
 */
public final class Pep440Version implements Comparable<Pep440Version> {

    private static final int PRE_ALPHA = 0;
    private static final int PRE_BETA = 1;
    private static final int PRE_RC = 2;
    // no pre-release segment, sorts after every pre-release
    private static final int PRE_NONE = 3;
    // development release of a final release, sorts before every pre-release
    private static final int PRE_DEV_ONLY = -1;

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "v?"
            + "(?:(?<epoch>[0-9]+)!)?"
            + "(?<release>[0-9]+(?:\\.[0-9]+)*)"
            + "(?:[-_.]?(?<preL>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<preN>[0-9]+)?)?"
            + "(?:-(?<postN1>[0-9]+)|[-_.]?(?<postL>post|rev|r)[-_.]?(?<postN2>[0-9]+)?)?"
            + "(?:[-_.]?(?<devL>dev)[-_.]?(?<devN>[0-9]+)?)?"
            + "(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?",
            Pattern.CASE_INSENSITIVE);

    @NotNull
    private static BigInteger number(@Nullable String text) {
        return text == null ? BigInteger.ZERO : new BigInteger(text);
    }

    /**
     * Parses a version string. Parsing never fails, but strings that do not follow the scheme
     * produce a version for which {@link #isValid()} is false.
     *
     * @param string The version string
     * @return The parsed version
     */
    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static Pep440Version parse(@NotNull String string) {
        String text = Objects.requireNonNull(string, "string may not be null").trim().toLowerCase(Locale.ROOT);
        Matcher matcher = VERSION_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return new Pep440Version(string, text);
        }

        BigInteger epoch = Pep440Version.number(matcher.group("epoch"));

        List<BigInteger> release = new ArrayList<>();
        for (String component : matcher.group("release").split("\\.")) {
            release.add(new BigInteger(component));
        }
        while (release.size() > 1 && release.get(release.size() - 1).signum() == 0) {
            release.remove(release.size() - 1);
        }

        String preLetter = matcher.group("preL");
        boolean post = matcher.group("postN1") != null || matcher.group("postL") != null;
        boolean dev = matcher.group("devL") != null;
        int preKind;
        if (preLetter == null) {
            preKind = (dev && !post) ? PRE_DEV_ONLY : PRE_NONE;
        } else if (preLetter.startsWith("a")) {
            preKind = PRE_ALPHA;
        } else if (preLetter.startsWith("b")) {
            preKind = PRE_BETA;
        } else {
            preKind = PRE_RC;
        }
        BigInteger preNumber = Pep440Version.number(matcher.group("preN"));

        BigInteger postNumber = null;
        if (post) {
            postNumber = Pep440Version.number(matcher.group("postN1") != null ? matcher.group("postN1") : matcher.group("postN2"));
        }
        BigInteger devNumber = dev ? Pep440Version.number(matcher.group("devN")) : null;

        List<String> local = Collections.emptyList();
        String localText = matcher.group("local");
        if (localText != null) {
            local = List.of(localText.split("[-_.]"));
        }

        return new Pep440Version(string, epoch, Collections.unmodifiableList(release), preKind, preNumber, postNumber, devNumber, local);
    }

    private static int compareLocal(@NotNull List<String> left, @NotNull List<String> right) {
        int length = Math.min(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean lNumeric = l.chars().allMatch(Character::isDigit);
            boolean rNumeric = r.chars().allMatch(Character::isDigit);
            int result;
            if (lNumeric && rNumeric) {
                result = new BigInteger(l).compareTo(new BigInteger(r));
            } else if (lNumeric != rNumeric) {
                // numeric segments sort after alphanumeric ones
                result = lNumeric ? 1 : -1;
            } else {
                result = l.compareTo(r);
            }
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareRelease(@NotNull List<BigInteger> left, @NotNull List<BigInteger> right) {
        int length = Math.max(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            BigInteger l = i < left.size() ? left.get(i) : BigInteger.ZERO;
            BigInteger r = i < right.size() ? right.get(i) : BigInteger.ZERO;
            int result = l.compareTo(r);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    @Nullable
    private final BigInteger devNumber;
    @NotNull
    private final BigInteger epoch;
    @Nullable
    private final String invalidText;
    @NotNull
    private final List<String> local;
    @NotNull
    private final String originText;
    @Nullable
    private final BigInteger postNumber;
    private final int preKind;
    @NotNull
    private final BigInteger preNumber;
    @NotNull
    private final List<BigInteger> release;

    private Pep440Version(@NotNull String originText, @NotNull BigInteger epoch, @NotNull List<BigInteger> release, int preKind,
            @NotNull BigInteger preNumber, @Nullable BigInteger postNumber, @Nullable BigInteger devNumber, @NotNull List<String> local) {
        this.originText = originText;
        this.invalidText = null;
        this.epoch = epoch;
        this.release = release;
        this.preKind = preKind;
        this.preNumber = preNumber;
        this.postNumber = postNumber;
        this.devNumber = devNumber;
        this.local = local;
    }

    private Pep440Version(@NotNull String originText, @NotNull String invalidText) {
        this.originText = originText;
        this.invalidText = invalidText;
        this.epoch = BigInteger.ZERO;
        this.release = Collections.emptyList();
        this.preKind = PRE_NONE;
        this.preNumber = BigInteger.ZERO;
        this.postNumber = null;
        this.devNumber = null;
        this.local = Collections.emptyList();
    }

    @Override
    public int compareTo(@NotNull Pep440Version o) {
        if (this.invalidText != null || o.invalidText != null) {
            if (this.invalidText == null) {
                return 1;
            } else if (o.invalidText == null) {
                return -1;
            }
            return this.invalidText.compareTo(o.invalidText);
        }

        int result = this.epoch.compareTo(o.epoch);
        if (result != 0) {
            return result;
        }
        result = Pep440Version.compareRelease(this.release, o.release);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(this.preKind, o.preKind);
        if (result != 0) {
            return result;
        }
        result = this.preNumber.compareTo(o.preNumber);
        if (result != 0) {
            return result;
        }

        // absent post segment < any post segment
        if (this.postNumber == null || o.postNumber == null) {
            result = this.postNumber == null ? (o.postNumber == null ? 0 : -1) : 1;
        } else {
            result = this.postNumber.compareTo(o.postNumber);
        }
        if (result != 0) {
            return result;
        }

        // any dev segment < absent dev segment
        if (this.devNumber == null || o.devNumber == null) {
            result = this.devNumber == null ? (o.devNumber == null ? 0 : 1) : -1;
        } else {
            result = this.devNumber.compareTo(o.devNumber);
        }
        if (result != 0) {
            return result;
        }

        return Pep440Version.compareLocal(this.local, o.local);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Pep440Version) {
            return this.compareTo((Pep440Version) obj) == 0;
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        if (this.invalidText != null) {
            return this.invalidText.hashCode();
        }
        List<BigInteger> release = new ArrayList<>(this.release);
        while (!release.isEmpty() && release.get(release.size() - 1).signum() == 0) {
            release.remove(release.size() - 1);
        }
        return Objects.hash(this.epoch, release, this.preKind, this.preNumber, this.postNumber, this.devNumber, this.local);
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull Pep440Version other) {
        return this.compareTo(other) > 0;
    }

    /**
     * Whether this version is a development, alpha, beta or release candidate version.
     * Post-releases of final releases are not pre-releases.
     *
     * @return True if this is a pre-release
     */
    @Contract(pure = true)
    public boolean isPreRelease() {
        return this.invalidText == null && (this.preKind != PRE_NONE || this.devNumber != null);
    }

    /**
     * Whether the version string follows the scheme.
     *
     * @return False if the version only compares lexically
     */
    @Contract(pure = true)
    public boolean isValid() {
        return this.invalidText == null;
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
