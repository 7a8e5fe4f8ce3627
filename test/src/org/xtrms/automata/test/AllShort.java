/*
 * @LICENSE@
 */
package org.xtrms.automata.test;

import org.xtrms.automata.SymbolTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(SymbolTestCase.class);
        suite.addTestSuite(FiniteAutomatonTestCase.class);
        suite.addTestSuite(SubsetConstructionTestCase.class);
        suite.addTestSuite(MinimizationTestCase.class);
        suite.addTestSuite(RegularGrammarTestCase.class);
        suite.addTestSuite(PushdownAutomatonTestCase.class);
        suite.addTestSuite(TransducerTestCase.class);
        suite.addTestSuite(JsonCodecTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
