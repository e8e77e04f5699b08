package com.herzen.rec.matrix;

import com.herzen.rec.matrix.MatrixModels.TfidfFeatures;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.util.Assert;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * TF-IDF over unigrams and bigrams of Lucene-analyzed text.
 * Smoothed idf, raw term counts and L2-normalized rows; the vocabulary keeps the
 * {@code maxFeatures} most frequent terms of the corpus it was fitted on.
 */
public class TfidfVectorizer {
    private static final String FIELD = "features";
    private static final int MIN_TOKEN_LENGTH = 2;

    private final int maxFeatures;
    private final CharArraySet stopWords;

    public TfidfVectorizer(int maxFeatures) {
        this(maxFeatures, EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
    }

    public TfidfVectorizer(int maxFeatures, CharArraySet stopWords) {
        Assert.isTrue(maxFeatures > 0, "maxFeatures must be positive");
        this.maxFeatures = maxFeatures;
        this.stopWords = stopWords;
    }

    public TfidfFeatures fitTransform(List<String> documents) {
        List<Map<String, Integer>> termCounts;
        try (Analyzer analyzer = new StandardAnalyzer(stopWords)) {
            termCounts = documents.stream()
                    .map(doc -> countTerms(terms(analyzer, doc)))
                    .toList();
        }

        Map<String, Integer> corpusFrequency = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Map<String, Integer> counts : termCounts) {
            counts.forEach((term, count) -> {
                corpusFrequency.merge(term, count, Integer::sum);
                documentFrequency.merge(term, 1, Integer::sum);
            });
        }

        List<String> vocabulary = corpusFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(maxFeatures)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < vocabulary.size(); i++) {
            columns.put(vocabulary.get(i), i);
        }

        int n = documents.size();
        double[] idf = new double[vocabulary.size()];
        for (int i = 0; i < vocabulary.size(); i++) {
            int df = documentFrequency.get(vocabulary.get(i));
            idf[i] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        }

        double[][] vectors = new double[n][vocabulary.size()];
        for (int d = 0; d < n; d++) {
            double[] row = vectors[d];
            termCounts.get(d).forEach((term, count) -> {
                Integer column = columns.get(term);
                if (column != null) {
                    row[column] = count * idf[column];
                }
            });
            Vectors.normalizeInPlace(row);
        }
        return new TfidfFeatures(vocabulary, vectors);
    }

    List<String> terms(Analyzer analyzer, String text) {
        List<String> tokens = tokenize(analyzer, text);
        List<String> terms = new ArrayList<>(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }

    private List<String> tokenize(Analyzer analyzer, String text) {
        List<String> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, text == null ? "" : text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                if (term.length() >= MIN_TOKEN_LENGTH) {
                    tokens.add(term.toString());
                }
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to analyze item text", e);
        }
        return tokens;
    }

    private Map<String, Integer> countTerms(List<String> terms) {
        return terms.stream().collect(Collectors.toMap(t -> t, t -> 1, Integer::sum, LinkedHashMap::new));
    }
}
