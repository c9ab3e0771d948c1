/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A theory: a language with axioms and least-fixed-point definitions.
 *
 * @author kafle
 */
public final class Theory {

    private final String name;
    private final Language language;
    private final List<Sentence> sentences;

    public Theory(String name, Language language, List<? extends Sentence> sentences) {
        this.name = name;
        this.language = language;
        this.sentences = Collections.unmodifiableList(new ArrayList<>(sentences));
    }

    public String getName() {
        return name;
    }

    public Language getLanguage() {
        return language;
    }

    public List<Sentence> getSentences() {
        return sentences;
    }

    public List<FixpointDefinition> getFixpointDefinitions() {
        List<FixpointDefinition> definitions = new ArrayList<>();
        for (Sentence sentence : sentences) {
            if (sentence instanceof FixpointDefinition) {
                definitions.add((FixpointDefinition) sentence);
            }
        }
        return definitions;
    }

    /**
     * @return the definition of the relation, or null if the relation is not
     * defined by a fixpoint
     */
    public FixpointDefinition getFixpointDefinition(RelationSymbol relation) {
        for (FixpointDefinition definition : getFixpointDefinitions()) {
            if (definition.getRelation().equals(relation)) {
                return definition;
            }
        }
        return null;
    }

    /**
     * All sentences as first-order formulas; fixpoint definitions become
     * universally closed equivalences.
     */
    public List<Formula> convertToFOTheory() {
        List<Formula> formulas = new ArrayList<>(sentences.size());
        for (Sentence sentence : sentences) {
            formulas.add(sentence.toFormula());
        }
        return formulas;
    }

    public Theory extendAxioms(Collection<? extends Formula> axioms) {
        List<Sentence> newSentences = new ArrayList<>(sentences);
        for (Formula axiom : axioms) {
            newSentences.add(new Axiom(axiom));
        }
        return new Theory(name, language, newSentences);
    }

    @Override
    public String toString() {
        return "theory " + name;
    }
}
