package com.lbg.feedreader.domain;

import java.util.List;

/**
 * Immutable seed set of feeds that is present without any user action.
 * Never persisted; merged in front of the stored feeds on every listing.
 */
public final class DefaultCatalog {

    private static final String BBC_IMAGE = "https://news.bbcimg.co.uk/nol/shared/img/bbc_news_120x60.gif";
    private static final String SKY_IMAGE = "http://feeds.skynews.com/images/web/logo/skynews_rss.png";

    private static final DefaultCatalog REFERENCE = new DefaultCatalog(List.of(
            new Feed(
                    "b1031651-411c-40bb-b269-d247794dfd59",
                    "BBC News - UK",
                    "BBC News - UK",
                    "http://feeds.bbci.co.uk/news/uk/rss.xml",
                    BBC_IMAGE,
                    ""
            ),
            new Feed(
                    "c2970c84-37c8-4ec1-8861-4b5a91ebff0d",
                    "BBC News - Technology",
                    "BBC News - Technology",
                    "http://feeds.bbci.co.uk/news/technology/rss.xml",
                    BBC_IMAGE,
                    ""
            ),
            new Feed(
                    "28059396-5113-46ed-b76b-6d482a3bbcf3",
                    "UK News - The latest headlines from the UK | Sky News",
                    "Expert comment and analysis on the latest UK news, with headlines from England, "
                            + "Scotland, Northern Ireland and Wales.",
                    "http://feeds.skynews.com/feeds/rss/uk.xml",
                    SKY_IMAGE,
                    "Sky News"
            ),
            new Feed(
                    "a2370e4f-0e7f-4844-83cb-b54c02b0bf1f",
                    "Tech News - Latest Technology and Gadget News | Sky News",
                    "Sky News technology provides you with all the latest tech and gadget news, game reviews, "
                            + "Internet and web news across the globe. Visit us today.",
                    "http://feeds.skynews.com/feeds/rss/technology.xml",
                    SKY_IMAGE,
                    "Sky News"
            )
    ));

    private static final DefaultCatalog EMPTY = new DefaultCatalog(List.of());

    private final List<Feed> feeds;

    private DefaultCatalog(List<Feed> feeds) {
        this.feeds = List.copyOf(feeds);
    }

    /**
     * The catalog shipped with the service.
     */
    public static DefaultCatalog reference() {
        return REFERENCE;
    }

    public static DefaultCatalog empty() {
        return EMPTY;
    }

    public static DefaultCatalog of(List<Feed> feeds) {
        for (Feed feed : feeds) {
            if (feed.id().isBlank()) {
                throw new IllegalArgumentException("Default feed must carry an id: " + feed.url());
            }
        }
        return new DefaultCatalog(feeds);
    }

    public List<Feed> feeds() {
        return feeds;
    }

    public int size() {
        return feeds.size();
    }
}
