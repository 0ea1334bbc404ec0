package com.gt.vocab.external;

public interface AnswerJudge {

    /**
     * @return a confidence in [0, 10] that the submitted answer is an acceptable form of the correct one
     */
    int judge(String correctAnswer, String submittedAnswer, String context);
}
