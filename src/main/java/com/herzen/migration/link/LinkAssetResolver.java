package com.herzen.migration.link;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.extract.HtmlCleaner;
import com.herzen.migration.inventory.CoursePaths;
import com.herzen.migration.inventory.InventoryModels.Inventory;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.transform.TargetModels.*;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class LinkAssetResolver {
    private static final Logger log = LoggerFactory.getLogger(LinkAssetResolver.class);

    private final MigrationProperties properties;
    private final HtmlCleaner cleaner;

    public LinkAssetResolver(MigrationProperties properties, HtmlCleaner cleaner) {
        this.properties = properties;
        this.cleaner = cleaner;
    }

    public TargetCourseGraph resolve(TargetCourseGraph graph, Inventory inventory, ReportAggregator report) {
        List<Topic> topics = new ArrayList<>();
        for (Topic topic : graph.topics()) {
            List<TopicItem> items = new ArrayList<>();
            for (TopicItem item : topic.items()) {
                TopicItem rewritten = item.withContent(rewrite(item.content(), item.id(), inventory, report));
                if (rewritten instanceof Quiz quiz) {
                    rewritten = quiz.withQuestions(quiz.questions().stream().map(q -> question(q, inventory, report)).toList());
                }
                items.add(rewritten);
            }
            topics.add(topic.withItems(items));
        }
        log.info("Asset references: resolved={}, missing={}", report.counter("assetsResolved"), report.counter("assetsMissing"));
        return new TargetCourseGraph(graph.course(), List.copyOf(topics));
    }

    private Question question(Question question, Inventory inventory, ReportAggregator report) {
        String content = rewrite(question.content(), question.id(), inventory, report);
        List<Answer> answers = question.answers().stream()
                .map(a -> a.withContent(rewrite(a.content(), question.id(), inventory, report)))
                .toList();
        return question.withContent(content, answers);
    }

    String rewrite(String html, String ownerId, Inventory inventory, ReportAggregator report) {
        if (html == null || html.isEmpty()) return html;
        String rewritten = cleaner.rewriteAssetPlaceholders(html);
        String prefix = properties.assetTargetPrefix();
        if (!rewritten.contains(prefix)) return rewritten;

        for (Element element : Jsoup.parseBodyFragment(rewritten).select("[src], [href]")) {
            for (String attribute : List.of("src", "href")) {
                String value = element.attr(attribute);
                if (!value.startsWith(prefix)) continue;
                String assetPath = CoursePaths.normalize(value.substring(prefix.length()));
                String sourcePath = assetPath == null ? null : properties.assetSourceDirectory() + "/" + assetPath;
                if (sourcePath != null && inventory.contains(sourcePath)) {
                    report.increment("assetsResolved");
                } else {
                    report.increment("assetsMissing");
                    report.warning(Stage.LINKS, "MISSING_ASSET", "Asset not found in course files: " + value, ownerId);
                }
            }
        }
        return rewritten;
    }
}
