/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import java.net.URI;
import java.util.Objects;

import org.w3c.dom.Element;

import villagecompute.sitemap.url.SitemapUrl;
import villagecompute.sitemap.xml.XmlTreeBuilder;

/**
 * Sitemap URL entry that can advertise an embedded video using Google's video sitemap extension.
 *
 * <p>
 * The {@code <url>} element is produced by {@link SitemapUrl#asElement(XmlTreeBuilder)} unchanged; when
 * {@link #hasVideo()} is true a single {@code video:video} element carrying the attributes is appended as its last
 * child.
 *
 * <pre>
 * VideoSitemapUrl url = new VideoSitemapUrl("https://example.com/watch/42");
 * url.video().setContentLoc("https://example.com/video.flv");
 * url.video().setPlayerLoc("https://example.com/player.swf");
 * </pre>
 */
public class VideoSitemapUrl extends SitemapUrl {

    private final VideoFragmentBuilder fragmentBuilder;
    private VideoAttributes video;

    public VideoSitemapUrl(String location) {
        super(location);
        this.fragmentBuilder = new VideoFragmentBuilder();
    }

    public VideoSitemapUrl(URI location) {
        super(location);
        this.fragmentBuilder = new VideoFragmentBuilder();
    }

    public VideoSitemapUrl(URI location, VideoAttributes video) {
        this(location, video, new VideoFragmentBuilder());
    }

    public VideoSitemapUrl(URI location, VideoAttributes video, VideoFragmentBuilder fragmentBuilder) {
        super(location);
        this.video = Objects.requireNonNull(video, "video");
        this.fragmentBuilder = Objects.requireNonNull(fragmentBuilder, "fragmentBuilder");
    }

    /**
     * Video attributes of this entry, created on first access.
     */
    public VideoAttributes video() {
        if (video == null) {
            video = new VideoAttributes();
        }
        return video;
    }

    /**
     * Whether a {@code video:video} block will be emitted, i.e. a content or player location is set.
     */
    public boolean hasVideo() {
        return video != null && video.hasVideo();
    }

    @Override
    public Element asElement(XmlTreeBuilder xml) {
        Element url = super.asElement(xml);

        if (hasVideo()) {
            Element container = xml.element(XmlTreeBuilder.VIDEO_PREFIX + ":video");
            for (Element child : fragmentBuilder.build(video, xml)) {
                container.appendChild(child);
            }
            url.appendChild(container);
        }

        return url;
    }
}
