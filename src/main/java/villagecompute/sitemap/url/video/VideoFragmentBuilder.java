/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.w3c.dom.Element;

import villagecompute.sitemap.xml.XmlText;
import villagecompute.sitemap.xml.XmlTreeBuilder;

/**
 * Turns {@link VideoAttributes} into the {@code video:*} child elements of a {@code video:video} block.
 *
 * <p>
 * <b>Algorithm:</b> for each name in {@link VideoAttributes#getFieldOrder()}:
 * <ol>
 * <li>skip names that match no {@link VideoField}, and fields whose presence flag is false</li>
 * <li>resolve the value through the registry's custom encoder, or take the stored value as-is</li>
 * <li>skip when the resolved value is {@code null}</li>
 * <li>treat a list as its entries and anything else as a one-entry list</li>
 * <li>wrap each entry in a {@code video:<field>} element, escaping it unless it is pre-escaped {@link XmlText}</li>
 * </ol>
 * Elements come out in field order, then list order. Empty strings and zeros are still emitted; only unset fields are
 * left out.
 *
 * <p>
 * {@link #build(VideoAttributes, XmlTreeBuilder)} never mutates the attributes, so repeated calls on unchanged state
 * produce identical output.
 */
public class VideoFragmentBuilder {

    private static final Logger LOG = Logger.getLogger(VideoFragmentBuilder.class);

    private final VideoFieldEncoders encoders;

    public VideoFragmentBuilder() {
        this(VideoFieldEncoders.standard());
    }

    public VideoFragmentBuilder(VideoFieldEncoders encoders) {
        this.encoders = Objects.requireNonNull(encoders, "encoders");
    }

    /**
     * Builds the ordered {@code video:<field>} elements for {@code video}.
     *
     * @param video
     *            attributes to render
     * @param xml
     *            builder owning the target document
     * @return detached elements, possibly empty
     */
    public List<Element> build(VideoAttributes video, XmlTreeBuilder xml) {
        List<Element> elements = new ArrayList<>();

        for (String fieldName : video.getFieldOrder()) {
            Optional<VideoField> known = VideoField.fromName(fieldName);
            if (known.isEmpty()) {
                LOG.debugf("Ignoring unknown video field '%s'", fieldName);
                continue;
            }
            VideoField field = known.get();
            if (!video.isSet(field)) {
                continue;
            }

            Object stored = video.get(field);
            Optional<VideoFieldEncoder> encoder = encoders.encoderFor(field);
            Object resolved = encoder.isPresent() ? encoder.get().encode(stored) : stored;
            if (resolved == null) {
                continue;
            }

            for (Object entry : asEntries(resolved)) {
                XmlText text = VideoFieldEncoders.defaultEncoding(entry);
                elements.add(xml.wrapIn(xml.text(text), field.elementName()));
            }
        }

        return elements;
    }

    private static Collection<?> asEntries(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        return List.of(value);
    }
}
