/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.Arrays;
import java.util.Collections;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class LanguageTest {

    private final Sort pointer = new Sort("Pointer");
    private final FunctionSymbol nil = new FunctionSymbol("nil", Collections.<Sort>emptyList(), pointer);
    private final FunctionSymbol sk0 = new FunctionSymbol("sk0", Collections.<Sort>emptyList(), pointer);
    private final RelationSymbol sk1 = new RelationSymbol("sk1", Arrays.asList(pointer));

    @Test
    public void freshNameSkipsEveryKindOfSymbol() {
        Language language = new Language(Arrays.asList(pointer), Arrays.asList(nil, sk0), Arrays.asList(sk1));
        String fresh = language.getFreshFunctionName("sk");
        assertEquals("sk2", fresh);
        assertFalse(language.hasName(fresh));
    }

    @Test
    public void freshNameOfEmptyLanguageStartsAtZero() {
        assertEquals("sk0", Language.empty().getFreshFunctionName("sk"));
    }

    @Test
    public void expansionLeavesOriginalUnchanged() {
        Language language = new Language(Arrays.asList(pointer), Arrays.asList(nil), Collections.<RelationSymbol>emptyList());
        Language expanded = language.expandWithFunction(sk0);
        assertTrue(expanded.hasName("sk0"));
        assertFalse(language.hasName("sk0"));
        assertEquals("sk1", expanded.getFreshFunctionName("sk"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateNamesAreRejected() {
        new Language(Arrays.asList(pointer), Arrays.asList(nil),
                Arrays.asList(new RelationSymbol("nil", Arrays.asList(pointer))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownSymbolIsRejected() {
        Language.empty().getFunctionSymbol("next");
    }

    @Test
    public void sublanguageKeepsOnlyNamedSymbols() {
        Language language = new Language(Arrays.asList(pointer), Arrays.asList(nil, sk0), Arrays.asList(sk1));
        Language sub = language.getSublanguage(new String[]{"Pointer"}, new String[]{"nil"}, new String[]{});
        assertEquals(Arrays.asList(nil), sub.getFunctionSymbols());
        assertTrue(sub.getRelationSymbols().isEmpty());
        assertEquals(pointer, sub.getSort("Pointer"));
    }
}
