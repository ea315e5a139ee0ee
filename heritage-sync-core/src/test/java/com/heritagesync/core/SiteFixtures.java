package com.heritagesync.core;

import com.heritagesync.core.model.ComponentSite;
import com.heritagesync.core.model.HeritageSite;
import com.heritagesync.core.model.SiteCategory;
import com.heritagesync.core.model.SiteTranslation;
import com.heritagesync.core.reader.RawComponentRecord;
import com.heritagesync.core.reader.RawSiteRecord;

import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for core tests.
 */
public final class SiteFixtures {

    public static final String WIKIDATA = "http://www.wikidata.org/entity/";

    private SiteFixtures() {
    }

    public static HeritageSite site(String id, double latitude, double longitude) {
        return new HeritageSite(id, id, "u" + id, latitude, longitude, "Asia and the Pacific", List.of("cn"),
            SiteCategory.CULTURAL, "(i)(ii)", 1987, "", false, "", false, 0, 0,
            "https://whc.unesco.org/en/list/" + id, "",
            Map.of("en", new SiteTranslation("Site " + id, "", "China", "", ""),
                "zh", new SiteTranslation("遗产 " + id, "", "中国", "", "")),
            false, 0, List.of());
    }

    public static ComponentSite component(String qid, String parentId, double latitude, double longitude) {
        return new ComponentSite(qid, WIKIDATA + qid, parentId, latitude, longitude,
            Map.of("en", "Component " + qid, "zh", "Component " + qid), null, null);
    }

    public static RawComponentRecord raw(String whsId, String qid, String lat, String lon) {
        return new RawComponentRecord(whsId, WIKIDATA + qid, "Label " + qid, lat, lon, "component", null, null);
    }

    public static RawSiteRecord row(String id, String name, String latitude, String longitude) {
        return new RawSiteRecord(id, "u" + id, name, "<p>Description of " + name + "</p>", "China", "Beijing",
            "Justification", latitude, longitude, "Asia and the Pacific", "cn", "Cultural", "(i)(ii)", "1987",
            "", "", "0", "0", "0", "https://whc.unesco.org/en/list/" + id, "");
    }
}
