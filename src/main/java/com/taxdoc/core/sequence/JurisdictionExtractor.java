package com.taxdoc.core.sequence;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight name heuristic for prefectures and municipalities. It does not classify; it only
 * pulls candidate names that slot matching can compare against the configured jurisdictions.
 */
public final class JurisdictionExtractor {

    static final List<String> PREFECTURES = List.of(
        "北海道", "青森県", "岩手県", "宮城県", "秋田県", "山形県", "福島県",
        "茨城県", "栃木県", "群馬県", "埼玉県", "千葉県", "東京都", "神奈川県",
        "新潟県", "富山県", "石川県", "福井県", "山梨県", "長野県", "岐阜県",
        "静岡県", "愛知県", "三重県", "滋賀県", "京都府", "大阪府", "兵庫県",
        "奈良県", "和歌山県", "鳥取県", "島根県", "岡山県", "広島県", "山口県",
        "徳島県", "香川県", "愛媛県", "高知県", "福岡県", "佐賀県", "長崎県",
        "熊本県", "大分県", "宮崎県", "鹿児島県", "沖縄県"
    );

    // A municipality name starts at a non-Han boundary or right after a prefecture suffix and is
    // followed by an office word or a non-Han character, so tax terms such as 法人市町村民税 never match.
    private static final Pattern MUNICIPALITY = Pattern.compile(
        "(?:(?<=[都道府県])|(?<![\\p{IsHan}ヶケ]))([\\p{IsHan}ヶケ]{1,5}?[市区町村])(?=役所|役場|長|[^\\p{IsHan}ヶケ]|$)");
    private static final Set<String> NOT_PLACE_NAMES = Set.of("市町村", "区市町村", "市区町村", "都道府県");

    private JurisdictionExtractor() {
    }

    public static ExtractedJurisdiction extract(String text) {
        if (text == null || text.isBlank()) {
            return new ExtractedJurisdiction(List.of(), List.of());
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        return new ExtractedJurisdiction(findPrefectures(normalized), findMunicipalities(normalized));
    }

    static List<String> findPrefectures(String text) {
        List<int[]> hits = new ArrayList<>();
        for (int i = 0; i < PREFECTURES.size(); i++) {
            int at = text.indexOf(PREFECTURES.get(i));
            if (at >= 0) {
                hits.add(new int[]{at, i});
            }
        }
        hits.sort(Comparator.comparingInt(hit -> hit[0]));
        List<String> names = new ArrayList<>(hits.size());
        for (int[] hit : hits) {
            names.add(PREFECTURES.get(hit[1]));
        }
        return names;
    }

    static List<String> findMunicipalities(String text) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = MUNICIPALITY.matcher(text);
        while (matcher.find()) {
            String name = stripLeadingPrefecture(matcher.group(1));
            if (name.length() < 2 || name.contains("税") || NOT_PLACE_NAMES.contains(name)) {
                continue;
            }
            names.add(name);
        }
        return new ArrayList<>(names);
    }

    static String stripLeadingPrefecture(String name) {
        for (String prefecture : PREFECTURES) {
            if (name.startsWith(prefecture) && name.length() > prefecture.length()) {
                return name.substring(prefecture.length());
            }
        }
        return name;
    }

    /**
     * Drops a trailing administrative suffix so "愛知県" and "愛知" compare equal.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String value = Normalizer.normalize(name, Normalizer.Form.NFKC).replaceAll("[\\s\\u3000]+", "");
        if (value.length() > 1) {
            char last = value.charAt(value.length() - 1);
            if ("都道府県市区町村".indexOf(last) >= 0 && !"北海道".equals(value)) {
                return value.substring(0, value.length() - 1);
            }
        }
        return value;
    }
}
