/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;

import villagecompute.sitemap.xml.XmlText;

/**
 * Registry of custom field encodings used by {@link VideoFragmentBuilder}.
 *
 * <p>
 * Fields without an entry use {@link #defaultEncoding(Object)}: the stored value becomes ordinary escaped text. The
 * standard registry customizes:
 * <ul>
 * <li>{@code player_loc}, {@code content_loc} - entity-escaped URI, written verbatim</li>
 * <li>{@code expiration_date}, {@code publication_date} - {@code yyyy-MM-dd'T'HH:mm:ss} followed by a numeric
 * {@code +HHMM} offset, written verbatim</li>
 * <li>{@code family_friendly} - {@code Yes} or {@code No}</li>
 * </ul>
 *
 * <p>
 * Instances are immutable; {@link #with(VideoField, VideoFieldEncoder)} returns a modified copy.
 */
public final class VideoFieldEncoders {

    /**
     * W3C date-time with a numeric offset. Never prints {@code Z} and drops fractional seconds.
     */
    public static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ssxx", Locale.ROOT);

    private static final Document.OutputSettings XML_ESCAPING = new Document.OutputSettings()
            .syntax(Document.OutputSettings.Syntax.xml).escapeMode(Entities.EscapeMode.xhtml)
            .charset(StandardCharsets.UTF_8);

    private static final VideoFieldEncoders STANDARD = createStandard();

    private final Map<VideoField, VideoFieldEncoder> encoders;

    private VideoFieldEncoders(Map<VideoField, VideoFieldEncoder> encoders) {
        this.encoders = Collections.unmodifiableMap(encoders);
    }

    public static VideoFieldEncoders standard() {
        return STANDARD;
    }

    /**
     * A registry with no custom encodings; every field uses the default.
     */
    public static VideoFieldEncoders empty() {
        return new VideoFieldEncoders(new EnumMap<>(VideoField.class));
    }

    /**
     * @return the custom encoder for {@code field}, or empty when the default applies
     */
    public Optional<VideoFieldEncoder> encoderFor(VideoField field) {
        return Optional.ofNullable(encoders.get(field));
    }

    /**
     * Returns a copy of this registry with {@code encoder} registered for {@code field}, replacing any existing one.
     */
    public VideoFieldEncoders with(VideoField field, VideoFieldEncoder encoder) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(encoder, "encoder");
        Map<VideoField, VideoFieldEncoder> copy = new EnumMap<>(VideoField.class);
        copy.putAll(encoders);
        copy.put(field, encoder);
        return new VideoFieldEncoders(copy);
    }

    /**
     * Returns a copy of this registry without a custom encoder for {@code field}.
     */
    public VideoFieldEncoders without(VideoField field) {
        Map<VideoField, VideoFieldEncoder> copy = new EnumMap<>(VideoField.class);
        copy.putAll(encoders);
        copy.remove(field);
        return new VideoFieldEncoders(copy);
    }

    /**
     * Default rendering: the value's string form, escaped by the serializer.
     */
    public static XmlText defaultEncoding(Object value) {
        return value instanceof XmlText text ? text : XmlText.escaped(String.valueOf(value));
    }

    static XmlText location(Object value) {
        return XmlText.preEscaped(Entities.escape(((URI) value).toString(), XML_ESCAPING));
    }

    static XmlText dateTime(Object value) {
        return XmlText.preEscaped(DATE_TIME_FORMATTER.format((OffsetDateTime) value));
    }

    static XmlText yesNo(Object value) {
        return XmlText.escaped(Boolean.TRUE.equals(value) ? "Yes" : "No");
    }

    private static VideoFieldEncoders createStandard() {
        Map<VideoField, VideoFieldEncoder> encoders = new EnumMap<>(VideoField.class);
        encoders.put(VideoField.PLAYER_LOC, VideoFieldEncoders::location);
        encoders.put(VideoField.CONTENT_LOC, VideoFieldEncoders::location);
        encoders.put(VideoField.EXPIRATION_DATE, VideoFieldEncoders::dateTime);
        encoders.put(VideoField.PUBLICATION_DATE, VideoFieldEncoders::dateTime);
        encoders.put(VideoField.FAMILY_FRIENDLY, VideoFieldEncoders::yesNo);
        return new VideoFieldEncoders(encoders);
    }
}
