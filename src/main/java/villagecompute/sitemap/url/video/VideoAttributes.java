/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import villagecompute.sitemap.exceptions.InvalidFieldValueException;
import villagecompute.sitemap.url.Locations;

/**
 * Video metadata attached to a sitemap URL entry.
 *
 * <p>
 * Every optional attribute is {@code null} until assigned, so presence is tracked separately from the value: an empty
 * title or a zero view count is still "set". {@code family_friendly} is the exception; it always has a value and
 * defaults to {@code true}.
 *
 * <p>
 * Setters validate eagerly and throw {@link InvalidFieldValueException}. Use the {@code clear*} methods (or
 * {@link #clear(VideoField)}) to unset a field; setters reject {@code null}.
 *
 * <p>
 * <b>Thread Safety:</b> not synchronized. Each instance belongs to one {@link VideoSitemapUrl}.
 */
public class VideoAttributes {

    private URI playerLoc;
    private URI contentLoc;
    private URI thumbnailLoc;
    private String title;
    private String description;
    private OffsetDateTime expirationDate;
    private Integer duration;
    private Double rating;
    private Integer viewCount;
    private OffsetDateTime publicationDate;
    private List<String> tag;
    private List<String> category;
    private boolean familyFriendly = true;
    private List<String> fieldOrder = VideoField.DEFAULT_ORDER;

    /**
     * A video can only be advertised when at least one of the content or player location is known.
     */
    public boolean hasVideo() {
        return hasContentLoc() || hasPlayerLoc();
    }

    // player_loc

    public URI getPlayerLoc() {
        return playerLoc;
    }

    public void setPlayerLoc(URI playerLoc) {
        this.playerLoc = location(VideoField.PLAYER_LOC, playerLoc);
    }

    public void setPlayerLoc(String playerLoc) {
        setPlayerLoc(parseLocation(VideoField.PLAYER_LOC, playerLoc));
    }

    public boolean hasPlayerLoc() {
        return playerLoc != null;
    }

    public void clearPlayerLoc() {
        this.playerLoc = null;
    }

    // content_loc

    public URI getContentLoc() {
        return contentLoc;
    }

    public void setContentLoc(URI contentLoc) {
        this.contentLoc = location(VideoField.CONTENT_LOC, contentLoc);
    }

    public void setContentLoc(String contentLoc) {
        setContentLoc(parseLocation(VideoField.CONTENT_LOC, contentLoc));
    }

    public boolean hasContentLoc() {
        return contentLoc != null;
    }

    public void clearContentLoc() {
        this.contentLoc = null;
    }

    // thumbnail_loc

    public URI getThumbnailLoc() {
        return thumbnailLoc;
    }

    public void setThumbnailLoc(URI thumbnailLoc) {
        this.thumbnailLoc = location(VideoField.THUMBNAIL_LOC, thumbnailLoc);
    }

    public void setThumbnailLoc(String thumbnailLoc) {
        setThumbnailLoc(parseLocation(VideoField.THUMBNAIL_LOC, thumbnailLoc));
    }

    public boolean hasThumbnailLoc() {
        return thumbnailLoc != null;
    }

    public void clearThumbnailLoc() {
        this.thumbnailLoc = null;
    }

    // title, description

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = required(VideoField.TITLE, title);
    }

    public boolean hasTitle() {
        return title != null;
    }

    public void clearTitle() {
        this.title = null;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = required(VideoField.DESCRIPTION, description);
    }

    public boolean hasDescription() {
        return description != null;
    }

    public void clearDescription() {
        this.description = null;
    }

    // dates

    public OffsetDateTime getExpirationDate() {
        return expirationDate;
    }

    public void setExpirationDate(OffsetDateTime expirationDate) {
        this.expirationDate = required(VideoField.EXPIRATION_DATE, expirationDate);
    }

    public boolean hasExpirationDate() {
        return expirationDate != null;
    }

    public void clearExpirationDate() {
        this.expirationDate = null;
    }

    public OffsetDateTime getPublicationDate() {
        return publicationDate;
    }

    public void setPublicationDate(OffsetDateTime publicationDate) {
        this.publicationDate = required(VideoField.PUBLICATION_DATE, publicationDate);
    }

    public boolean hasPublicationDate() {
        return publicationDate != null;
    }

    public void clearPublicationDate() {
        this.publicationDate = null;
    }

    // numbers

    public Integer getDuration() {
        return duration;
    }

    /**
     * @param duration
     *            running time in seconds
     */
    public void setDuration(int duration) {
        this.duration = nonNegative(VideoField.DURATION, duration);
    }

    public boolean hasDuration() {
        return duration != null;
    }

    public void clearDuration() {
        this.duration = null;
    }

    public Integer getViewCount() {
        return viewCount;
    }

    public void setViewCount(int viewCount) {
        this.viewCount = nonNegative(VideoField.VIEW_COUNT, viewCount);
    }

    public boolean hasViewCount() {
        return viewCount != null;
    }

    public void clearViewCount() {
        this.viewCount = null;
    }

    public Double getRating() {
        return rating;
    }

    /**
     * @param rating
     *            between 0.0 and 5.0 inclusive
     */
    public void setRating(double rating) {
        if (!Double.isFinite(rating) || rating < 0.0 || rating > 5.0) {
            throw new InvalidFieldValueException(VideoField.RATING.fieldName(),
                    "must be between 0.0 and 5.0, got " + rating);
        }
        this.rating = rating;
    }

    public boolean hasRating() {
        return rating != null;
    }

    public void clearRating() {
        this.rating = null;
    }

    // lists

    public List<String> getTag() {
        return tag;
    }

    public void setTag(List<String> tag) {
        this.tag = entries(VideoField.TAG, tag);
    }

    public boolean hasTag() {
        return tag != null;
    }

    public void clearTag() {
        this.tag = null;
    }

    public List<String> getCategory() {
        return category;
    }

    public void setCategory(List<String> category) {
        this.category = entries(VideoField.CATEGORY, category);
    }

    public boolean hasCategory() {
        return category != null;
    }

    public void clearCategory() {
        this.category = null;
    }

    // family_friendly

    public boolean isFamilyFriendly() {
        return familyFriendly;
    }

    public void setFamilyFriendly(boolean familyFriendly) {
        this.familyFriendly = familyFriendly;
    }

    /**
     * Always {@code true}: the flag has a default and cannot be unset.
     */
    public boolean hasFamilyFriendly() {
        return true;
    }

    /**
     * Restores the default ({@code true}).
     */
    public void clearFamilyFriendly() {
        this.familyFriendly = true;
    }

    // field order

    /**
     * Field names in the order their elements are emitted. Names that match no {@link VideoField} are kept but produce
     * no output.
     */
    public List<String> getFieldOrder() {
        return fieldOrder;
    }

    public void setFieldOrder(List<String> fieldOrder) {
        Objects.requireNonNull(fieldOrder, "fieldOrder");
        this.fieldOrder = List.copyOf(fieldOrder);
    }

    public void resetFieldOrder() {
        this.fieldOrder = VideoField.DEFAULT_ORDER;
    }

    // field-driven access

    /**
     * Presence flag of a field.
     */
    public boolean isSet(VideoField field) {
        return switch (field) {
            case PLAYER_LOC -> hasPlayerLoc();
            case CONTENT_LOC -> hasContentLoc();
            case THUMBNAIL_LOC -> hasThumbnailLoc();
            case TITLE -> hasTitle();
            case DESCRIPTION -> hasDescription();
            case EXPIRATION_DATE -> hasExpirationDate();
            case DURATION -> hasDuration();
            case RATING -> hasRating();
            case VIEW_COUNT -> hasViewCount();
            case PUBLICATION_DATE -> hasPublicationDate();
            case TAG -> hasTag();
            case CATEGORY -> hasCategory();
            case FAMILY_FRIENDLY -> hasFamilyFriendly();
        };
    }

    /**
     * Stored value of a field, or {@code null} when unset. List fields return an unmodifiable list.
     */
    public Object get(VideoField field) {
        return switch (field) {
            case PLAYER_LOC -> playerLoc;
            case CONTENT_LOC -> contentLoc;
            case THUMBNAIL_LOC -> thumbnailLoc;
            case TITLE -> title;
            case DESCRIPTION -> description;
            case EXPIRATION_DATE -> expirationDate;
            case DURATION -> duration;
            case RATING -> rating;
            case VIEW_COUNT -> viewCount;
            case PUBLICATION_DATE -> publicationDate;
            case TAG -> tag;
            case CATEGORY -> category;
            case FAMILY_FRIENDLY -> familyFriendly;
        };
    }

    /**
     * Assigns a field from a loosely typed value, e.g. one read from configuration or a request payload.
     *
     * <p>
     * Locations accept {@link URI} or {@link String}; dates accept {@link OffsetDateTime} or {@link ZonedDateTime};
     * integer fields accept integral numbers within {@code int} range; list fields accept collections of strings.
     * Values of the wrong shape, including a collection given to a scalar field, are rejected rather than coerced.
     *
     * @throws InvalidFieldValueException
     *             if the value does not fit the field
     */
    public void set(VideoField field, Object value) {
        if (value == null) {
            throw new InvalidFieldValueException(field.fieldName(), "value must not be null, use clear instead");
        }
        if (!field.isList() && value instanceof Collection) {
            throw new InvalidFieldValueException(field.fieldName(), "expected a single value, got a list");
        }
        switch (field) {
            case PLAYER_LOC -> setPlayerLoc(asUri(field, value));
            case CONTENT_LOC -> setContentLoc(asUri(field, value));
            case THUMBNAIL_LOC -> setThumbnailLoc(asUri(field, value));
            case TITLE -> setTitle(as(field, value, String.class));
            case DESCRIPTION -> setDescription(as(field, value, String.class));
            case EXPIRATION_DATE -> setExpirationDate(asDateTime(field, value));
            case PUBLICATION_DATE -> setPublicationDate(asDateTime(field, value));
            case DURATION -> setDuration(asInt(field, value));
            case VIEW_COUNT -> setViewCount(asInt(field, value));
            case RATING -> setRating(as(field, value, Number.class).doubleValue());
            case TAG -> setTag(asStrings(field, value));
            case CATEGORY -> setCategory(asStrings(field, value));
            case FAMILY_FRIENDLY -> setFamilyFriendly(as(field, value, Boolean.class));
        }
    }

    /**
     * Unsets a field; {@code family_friendly} returns to its default.
     */
    public void clear(VideoField field) {
        switch (field) {
            case PLAYER_LOC -> clearPlayerLoc();
            case CONTENT_LOC -> clearContentLoc();
            case THUMBNAIL_LOC -> clearThumbnailLoc();
            case TITLE -> clearTitle();
            case DESCRIPTION -> clearDescription();
            case EXPIRATION_DATE -> clearExpirationDate();
            case DURATION -> clearDuration();
            case RATING -> clearRating();
            case VIEW_COUNT -> clearViewCount();
            case PUBLICATION_DATE -> clearPublicationDate();
            case TAG -> clearTag();
            case CATEGORY -> clearCategory();
            case FAMILY_FRIENDLY -> clearFamilyFriendly();
        }
    }

    private static URI location(VideoField field, URI value) {
        return Locations.requireAbsoluteHttp(field.fieldName(), value);
    }

    private static URI parseLocation(VideoField field, String value) {
        return Locations.parse(field.fieldName(), value);
    }

    private static <T> T required(VideoField field, T value) {
        if (value == null) {
            throw new InvalidFieldValueException(field.fieldName(), "value must not be null, use clear instead");
        }
        return value;
    }

    private static Integer nonNegative(VideoField field, int value) {
        if (value < 0) {
            throw new InvalidFieldValueException(field.fieldName(), "must not be negative, got " + value);
        }
        return value;
    }

    private static List<String> entries(VideoField field, List<String> values) {
        required(field, values);
        for (String value : values) {
            if (value == null) {
                throw new InvalidFieldValueException(field.fieldName(), "list entries must not be null");
            }
        }
        return List.copyOf(values);
    }

    private static <T> T as(VideoField field, Object value, Class<T> type) {
        if (value == null) {
            throw new InvalidFieldValueException(field.fieldName(), "expected " + type.getSimpleName() + ", got null");
        }
        if (!type.isInstance(value)) {
            throw new InvalidFieldValueException(field.fieldName(),
                    "expected " + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    private static URI asUri(VideoField field, Object value) {
        if (value instanceof URI uri) {
            return uri;
        }
        return parseLocation(field, as(field, value, String.class));
    }

    private static OffsetDateTime asDateTime(VideoField field, Object value) {
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toOffsetDateTime();
        }
        return as(field, value, OffsetDateTime.class);
    }

    private static int asInt(VideoField field, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
            throw new InvalidFieldValueException(field.fieldName(), "out of range: " + number);
        }
        throw new InvalidFieldValueException(field.fieldName(),
                "expected an integer, got " + value.getClass().getSimpleName());
    }

    private static List<String> asStrings(VideoField field, Object value) {
        if (!(value instanceof Collection<?> collection)) {
            throw new InvalidFieldValueException(field.fieldName(),
                    "expected a list of strings, got " + value.getClass().getSimpleName());
        }
        List<String> strings = new ArrayList<>(collection.size());
        for (Object entry : collection) {
            strings.add(as(field, entry, String.class));
        }
        return strings;
    }
}
