package org.stianloader.shyresolve.version;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A version string ordered according to the maven version order specification.
 *
 * <p>See https://maven.apache.org/pom.html#Version_Order_Specification. The string is split into
 * numeric and qualifier parts on '.', '-' and digit/letter transitions. '-' opens a sublist, trailing
 * "null" values (0, "", "final", "ga", "release") are dropped and well-known qualifiers are ordered
 * as alpha &lt; beta &lt; milestone &lt; rc &lt; snapshot &lt; "" &lt; sp, with unknown qualifiers
 * sorting lexically after sp.
 *
 * <p>Two versions that are {@link #compareTo(MavenVersion) equal} are {@link #equals(Object) equal} even if their
 * {@link #getOriginText() origin text} differs ("1.0" and "1" for example).
 */
public final class MavenVersion implements Comparable<MavenVersion> {

    private static interface MavenVersionPart {
        int compareTo(@Nullable MavenVersionPart other);

        boolean isNull();
    }

    private static final class NumericVersionPart implements MavenVersionPart {
        private static final NumericVersionPart ZERO = new NumericVersionPart(BigInteger.ZERO);

        @NotNull
        private final BigInteger value;

        private NumericVersionPart(@NotNull BigInteger value) {
            this.value = value;
        }

        @Override
        public int compareTo(@Nullable MavenVersionPart other) {
            if (other == null) {
                return this.value.signum() == 0 ? 0 : 1;
            } else if (other instanceof NumericVersionPart) {
                return this.value.compareTo(((NumericVersionPart) other).value);
            }
            // 1.1 > 1-sp > 1-1 > 1-alpha
            return 1;
        }

        @Override
        public boolean isNull() {
            return this.value.signum() == 0;
        }

        @Override
        public String toString() {
            return this.value.toString();
        }
    }

    private static final class QualifierVersionPart implements MavenVersionPart {
        private static final List<String> QUALIFIERS = Arrays.asList("alpha", "beta", "milestone", "rc", "snapshot", "", "sp");
        private static final String RELEASE_INDEX = String.valueOf(QUALIFIERS.indexOf(""));

        @NotNull
        private static String comparableQualifier(@NotNull String qualifier) {
            int index = QUALIFIERS.indexOf(qualifier);
            return index == -1 ? (QUALIFIERS.size() + "-" + qualifier) : String.valueOf(index);
        }

        @NotNull
        private final String value;

        private QualifierVersionPart(@NotNull String value, boolean followedByDigit) {
            if (followedByDigit && value.length() == 1) {
                switch (value.charAt(0)) {
                case 'a':
                    value = "alpha";
                    break;
                case 'b':
                    value = "beta";
                    break;
                case 'm':
                    value = "milestone";
                    break;
                default:
                    break;
                }
            }
            switch (value) {
            case "ga":
            case "final":
            case "release":
                value = "";
                break;
            case "cr":
                value = "rc";
                break;
            default:
                break;
            }
            this.value = value;
        }

        @Override
        public int compareTo(@Nullable MavenVersionPart other) {
            if (other == null) {
                return QualifierVersionPart.comparableQualifier(this.value).compareTo(RELEASE_INDEX);
            } else if (other instanceof QualifierVersionPart) {
                return QualifierVersionPart.comparableQualifier(this.value).compareTo(QualifierVersionPart.comparableQualifier(((QualifierVersionPart) other).value));
            }
            return -1;
        }

        @Override
        public boolean isNull() {
            return this.value.isEmpty();
        }

        @Override
        public String toString() {
            return this.value;
        }
    }

    private static final class ListVersionPart implements MavenVersionPart {
        private final List<@NotNull MavenVersionPart> parts = new ArrayList<>();

        @Override
        public int compareTo(@Nullable MavenVersionPart other) {
            if (other == null) {
                for (MavenVersionPart part : this.parts) {
                    int result = part.compareTo(null);
                    if (result != 0) {
                        return result;
                    }
                }
                return 0;
            } else if (other instanceof NumericVersionPart) {
                return -1;
            } else if (other instanceof QualifierVersionPart) {
                return 1;
            }

            Iterator<MavenVersionPart> left = this.parts.iterator();
            Iterator<MavenVersionPart> right = ((ListVersionPart) other).parts.iterator();
            while (left.hasNext() || right.hasNext()) {
                MavenVersionPart l = left.hasNext() ? left.next() : null;
                MavenVersionPart r = right.hasNext() ? right.next() : null;
                int result;
                if (l == null) {
                    result = r == null ? 0 : -r.compareTo(null);
                } else {
                    result = l.compareTo(r);
                }
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        }

        @Override
        public boolean isNull() {
            return this.parts.isEmpty();
        }

        void normalize() {
            for (int i = this.parts.size() - 1; i >= 0; i--) {
                MavenVersionPart last = this.parts.get(i);
                if (last.isNull()) {
                    this.parts.remove(i);
                } else if (!(last instanceof ListVersionPart)) {
                    break;
                }
            }
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            for (MavenVersionPart part : this.parts) {
                if (builder.length() > 0) {
                    builder.append(part instanceof ListVersionPart ? '-' : '.');
                }
                builder.append(part);
            }
            return builder.toString();
        }
    }

    @NotNull
    private static MavenVersionPart parsePart(boolean numeric, @NotNull String text, boolean followedByDigit) {
        if (numeric) {
            return new NumericVersionPart(new BigInteger(text));
        }
        return new QualifierVersionPart(text, followedByDigit);
    }

    /**
     * Parses a version string. Parsing never fails, every string is a valid (if potentially
     * meaningless) maven version.
     *
     * @param string The version string
     * @return The parsed version
     */
    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static MavenVersion parse(@NotNull String string) {
        String version = Objects.requireNonNull(string, "string may not be null").toLowerCase(Locale.ROOT);
        ListVersionPart root = new ListVersionPart();
        ListVersionPart list = root;
        Deque<ListVersionPart> stack = new ArrayDeque<>();
        stack.push(list);

        boolean digit = false;
        int startIndex = 0;

        for (int i = 0; i < version.length(); i++) {
            char c = version.charAt(i);
            if (c == '.') {
                if (i == startIndex) {
                    list.parts.add(NumericVersionPart.ZERO);
                } else {
                    list.parts.add(MavenVersion.parsePart(digit, version.substring(startIndex, i), false));
                }
                startIndex = i + 1;
            } else if (c == '-') {
                if (i == startIndex) {
                    list.parts.add(NumericVersionPart.ZERO);
                } else {
                    list.parts.add(MavenVersion.parsePart(digit, version.substring(startIndex, i), false));
                }
                startIndex = i + 1;
                ListVersionPart sublist = new ListVersionPart();
                list.parts.add(sublist);
                list = sublist;
                stack.push(list);
            } else if (c >= '0' && c <= '9') {
                if (!digit && i > startIndex) {
                    list.parts.add(new QualifierVersionPart(version.substring(startIndex, i), true));
                    startIndex = i;
                    ListVersionPart sublist = new ListVersionPart();
                    list.parts.add(sublist);
                    list = sublist;
                    stack.push(list);
                }
                digit = true;
            } else {
                if (digit && i > startIndex) {
                    list.parts.add(MavenVersion.parsePart(true, version.substring(startIndex, i), false));
                    startIndex = i;
                    ListVersionPart sublist = new ListVersionPart();
                    list.parts.add(sublist);
                    list = sublist;
                    stack.push(list);
                }
                digit = false;
            }
        }

        if (version.length() > startIndex) {
            list.parts.add(MavenVersion.parsePart(digit, version.substring(startIndex), false));
        }

        while (!stack.isEmpty()) {
            stack.pop().normalize();
        }

        return new MavenVersion(string, root);
    }

    @NotNull
    private final String originText;

    @NotNull
    private final ListVersionPart parts;

    private MavenVersion(@NotNull String originText, @NotNull ListVersionPart parts) {
        this.originText = originText;
        this.parts = parts;
    }

    @Override
    public int compareTo(@NotNull MavenVersion o) {
        return this.parts.compareTo(o.parts);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MavenVersion) {
            return this.compareTo((MavenVersion) obj) == 0;
        }
        return false;
    }

    /**
     * Obtains the string this version was parsed from, without any normalization applied.
     *
     * @return The original version string
     */
    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        return this.parts.toString().hashCode();
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull MavenVersion other) {
        return this.compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
