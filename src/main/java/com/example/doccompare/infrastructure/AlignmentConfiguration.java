package com.example.doccompare.infrastructure;

import com.example.doccompare.alignment.CharacterSimilarity;
import com.example.doccompare.alignment.SentenceAligner;
import com.example.doccompare.alignment.TokenDiffer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AlignmentConfiguration {

    @Bean
    public SentenceAligner sentenceAligner() {
        return new SentenceAligner(new TokenDiffer(), new CharacterSimilarity());
    }
}
