/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.reportgrid.export;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives export file names from report titles: {@code {Stem}_{yyyyMMdd_HHmm}.{ext}}.
 *
 * <p>The stem comes from the first entry of a fixed keyword table whose keyword occurs
 * in the title, ignoring case; titles matching no keyword get the fallback stem. Only
 * {@code A-Z a-z 0-9 _ -} ever reach a file name.</p>
 */
public class ReportFileNames {

    public static final String DEFAULT_FALLBACK_STEM = "Microsoft365_Report";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm", Locale.ROOT);

    /** First match wins, so more specific keywords come before general ones. */
    private static final List<Map.Entry<String, String>> KEYWORDS = List.of(
        Map.entry("日次", "Daily_Report"),
        Map.entry("daily", "Daily_Report"),
        Map.entry("週次", "Weekly_Report"),
        Map.entry("weekly", "Weekly_Report"),
        Map.entry("月次", "Monthly_Report"),
        Map.entry("monthly", "Monthly_Report"),
        Map.entry("年次", "Yearly_Report"),
        Map.entry("yearly", "Yearly_Report"),
        Map.entry("annual", "Yearly_Report"),
        Map.entry("ライセンス", "License_Analysis"),
        Map.entry("license", "License_Analysis"),
        Map.entry("使用状況", "Usage_Analysis"),
        Map.entry("usage", "Usage_Analysis"),
        Map.entry("パフォーマンス", "Performance_Analysis"),
        Map.entry("performance", "Performance_Analysis"),
        Map.entry("セキュリティ", "Security_Analysis"),
        Map.entry("security", "Security_Analysis"),
        Map.entry("権限監査", "Permission_Audit"),
        Map.entry("permission audit", "Permission_Audit"),
        Map.entry("ユーザー", "User_Management"),
        Map.entry("user", "User_Management"),
        Map.entry("mfa", "MFA_Status"),
        Map.entry("条件付きアクセス", "Conditional_Access"),
        Map.entry("conditional access", "Conditional_Access"),
        Map.entry("サインイン", "SignIn_Logs"),
        Map.entry("sign-in", "SignIn_Logs"),
        Map.entry("signin", "SignIn_Logs"),
        Map.entry("メールボックス", "Mailbox_Management"),
        Map.entry("mailbox", "Mailbox_Management"),
        Map.entry("メールフロー", "Mail_Flow"),
        Map.entry("mail flow", "Mail_Flow"),
        Map.entry("スパム", "Spam_Protection"),
        Map.entry("spam", "Spam_Protection"),
        Map.entry("配信", "Delivery_Analysis"),
        Map.entry("delivery", "Delivery_Analysis"),
        Map.entry("teams", "Teams_Management"),
        Map.entry("チーム", "Teams_Management"),
        Map.entry("onedrive", "OneDrive_Management"),
        Map.entry("ワンドライブ", "OneDrive_Management")
    );

    private final Clock clock;
    private final ZoneId zone;
    private final String fallbackStem;

    public ReportFileNames(Clock clock, ZoneId zone, String fallbackStem) {
        this.clock = clock;
        this.zone = zone;
        this.fallbackStem = sanitize(fallbackStem).isEmpty() ? DEFAULT_FALLBACK_STEM : sanitize(fallbackStem);
    }

    public String stemFor(String title) {
        if (title != null) {
            String lower = title.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> keyword : KEYWORDS) {
                if (lower.contains(keyword.getKey())) {
                    return keyword.getValue();
                }
            }
        }
        return fallbackStem;
    }

    /**
     * @param title the report title
     * @param extension the file extension without the dot
     * @return the file name for an export made now
     */
    public String fileName(String title, String extension) {
        return stemFor(title) + "_" + timestamp() + "." + sanitize(extension);
    }

    public String timestamp() {
        return TIMESTAMP.format(now());
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    /**
     * @return the text with every character outside {@code A-Z a-z 0-9 _ -} removed
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("[^A-Za-z0-9_-]", "");
    }
}
