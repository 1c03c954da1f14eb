package com.herzen.quiz.selection;

import com.herzen.quiz.domain.DomainModels.Question;
import com.herzen.quiz.domain.DomainModels.QuizSettings;
import com.herzen.quiz.error.EmptyQuestionListException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class QuestionSelectorTest {
    private final QuestionSelector selector = new QuestionSelector(new Random(42));

    @Test
    void keepsOrderAndTruncatesWhenSequential() {
        List<Question> questions = questions(5);

        List<Question> selected = selector.select(questions, new QuizSettings(3, false, 30));

        assertEquals(questions.subList(0, 3), selected);
    }

    @Test
    void returnsAllQuestionsWhenCountAbsentOrTooLarge() {
        List<Question> questions = questions(4);

        assertEquals(questions, selector.select(questions, new QuizSettings(null, false, 30)));
        assertEquals(questions, selector.select(questions, new QuizSettings(10, false, 30)));
    }

    @Test
    void shuffledSelectionIsDuplicateFreeSubset() {
        List<Question> questions = questions(20);

        for (int count = 1; count <= 25; count++) {
            List<Question> selected = selector.select(questions, new QuizSettings(count, true, 30));
            assertEquals(Math.min(count, questions.size()), selected.size());
            assertEquals(selected.size(), new HashSet<>(selected).size());
            assertTrue(questions.containsAll(selected));
        }
    }

    @Test
    void doesNotModifyInput() {
        List<Question> questions = new java.util.ArrayList<>(questions(6));
        List<Question> before = List.copyOf(questions);

        selector.select(questions, new QuizSettings(2, true, 30));

        assertEquals(before, questions);
    }

    @Test
    void nonPositiveCountYieldsEmptyList() {
        assertTrue(selector.select(questions(3), new QuizSettings(0, false, 30)).isEmpty());
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(EmptyQuestionListException.class,
                () -> selector.select(List.of(), new QuizSettings(null, false, 30)));
    }

    private static List<Question> questions(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new Question("Question " + i, "Answer " + i))
                .toList();
    }
}
