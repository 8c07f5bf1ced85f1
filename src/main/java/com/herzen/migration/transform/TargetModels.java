package com.herzen.migration.transform;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.herzen.migration.source.SourceModels.Origin;

import java.util.List;
import java.util.stream.Stream;

public class TargetModels {
    public static final String COURSE_PREFIX = "course:";
    public static final String TOPIC_PREFIX = "topic:";
    public static final String LESSON_PREFIX = "lesson:";
    public static final String QUIZ_PREFIX = "quiz:";
    public static final String ASSIGNMENT_PREFIX = "assignment:";
    public static final String QUESTION_PREFIX = "question:";
    public static final String ANSWER_PREFIX = "answer:";

    public record TargetCourseGraph(Course course, List<Topic> topics) {
        @JsonIgnore
        public Stream<TopicItem> items() {
            return topics.stream().flatMap(t -> t.items().stream());
        }

        @JsonIgnore
        public List<Lesson> lessons() {
            return items().filter(Lesson.class::isInstance).map(Lesson.class::cast).toList();
        }

        @JsonIgnore
        public List<Quiz> quizzes() {
            return items().filter(Quiz.class::isInstance).map(Quiz.class::cast).toList();
        }

        @JsonIgnore
        public List<Assignment> assignments() {
            return items().filter(Assignment.class::isInstance).map(Assignment.class::cast).toList();
        }
    }

    public record Course(String id, String parentId, String title, int order, String content,
                         String sourceId, String sourcePath) {}

    public record Topic(String id, String parentId, String title, int order, String content,
                        String sourceId, String sourcePath, List<TopicItem> items) {
        public Topic withItems(List<TopicItem> newItems) {
            return new Topic(id, parentId, title, order, content, sourceId, sourcePath, List.copyOf(newItems));
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Lesson.class, name = "lesson"),
            @JsonSubTypes.Type(value = Quiz.class, name = "quiz"),
            @JsonSubTypes.Type(value = Assignment.class, name = "assignment")
    })
    public sealed interface TopicItem permits Lesson, Quiz, Assignment {
        String id();

        String parentId();

        String title();

        int order();

        String content();

        String sourceId();

        String sourcePath();

        TopicItem withContent(String newContent);
    }

    public record Lesson(String id, String parentId, String title, int order, String content,
                         String sourceId, String sourcePath, Origin origin, String notes) implements TopicItem {
        @Override
        public Lesson withContent(String newContent) {
            return new Lesson(id, parentId, title, order, newContent, sourceId, sourcePath, origin, notes);
        }
    }

    public record Quiz(String id, String parentId, String title, int order, String content,
                       String sourceId, String sourcePath,
                       int timeLimitMinutes, int attemptsAllowed, int passingGrade,
                       List<Question> questions) implements TopicItem {
        @Override
        public Quiz withContent(String newContent) {
            return new Quiz(id, parentId, title, order, newContent, sourceId, sourcePath,
                    timeLimitMinutes, attemptsAllowed, passingGrade, questions);
        }

        public Quiz withQuestions(List<Question> newQuestions) {
            return new Quiz(id, parentId, title, order, content, sourceId, sourcePath,
                    timeLimitMinutes, attemptsAllowed, passingGrade, List.copyOf(newQuestions));
        }
    }

    public record Assignment(String id, String parentId, String title, int order, String content,
                             String sourceId, String sourcePath,
                             String dueAt, double totalPoints, double passPoints,
                             boolean metadataDefaulted) implements TopicItem {
        @Override
        public Assignment withContent(String newContent) {
            return new Assignment(id, parentId, title, order, newContent, sourceId, sourcePath,
                    dueAt, totalPoints, passPoints, metadataDefaulted);
        }
    }

    public record Question(String id, String parentId, String title, int order, String content,
                           String sourceId, String sourcePath,
                           String sourceKind, TargetQuestionKind kind, MappingConfidence confidence,
                           double mark, List<Answer> answers) {
        public Question withContent(String newContent, List<Answer> newAnswers) {
            return new Question(id, parentId, title, order, newContent, sourceId, sourcePath,
                    sourceKind, kind, confidence, mark, List.copyOf(newAnswers));
        }
    }

    public record Answer(String id, String parentId, int order, String content, boolean correct) {
        public Answer withContent(String newContent) {
            return new Answer(id, parentId, order, newContent, correct);
        }
    }
}
