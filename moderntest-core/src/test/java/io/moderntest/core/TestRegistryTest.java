/*
 * The MIT License
 *
 * Copyright 2025 ModernTest contributors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.moderntest.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestRegistryTest {

    @Test
    void testDeclarationOrderAndStatus() {
        TestRegistry registry = TestRegistry.builder()
                .test("first", t -> {
                })
                .skip("second", t -> {
                })
                .only("third", t -> {
                })
                .build();

        List<TestCase> tests = registry.listAll();
        assertEquals(3, tests.size());
        assertEquals(3, registry.size());
        assertEquals("first", tests.get(0).getName());
        assertEquals(TestStatus.NORMAL, tests.get(0).getStatus());
        assertEquals("second", tests.get(1).getName());
        assertEquals(TestStatus.SKIP, tests.get(1).getStatus());
        assertEquals("third", tests.get(2).getName());
        assertEquals(TestStatus.ONLY, tests.get(2).getStatus());
    }

    @Test
    void testDuplicateNamesAreKept() {
        TestRegistry registry = TestRegistry.builder()
                .test("same", t -> {
                })
                .test("same", t -> {
                })
                .build();
        assertEquals(2, registry.size());
    }

    @Test
    void testListIsUnmodifiable() {
        TestRegistry registry = TestRegistry.builder()
                .test("a", t -> {
                })
                .build();
        assertThrows(UnsupportedOperationException.class, () -> registry.listAll().clear());
    }

    @Test
    void testRegistrationCapturesCallSite() {
        int before = new Throwable().getStackTrace()[0].getLineNumber();
        TestRegistry registry = TestRegistry.builder()
                .test("located", t -> {
                })
                .build();
        int after = new Throwable().getStackTrace()[0].getLineNumber();

        TestCase tc = registry.listAll().get(0);
        assertEquals("TestRegistryTest.java", tc.getSourceFile());
        assertTrue(tc.getSourceLine() > before);
        assertTrue(tc.getSourceLine() < after);
        assertEquals(tc.getSourceFile() + ":" + tc.getSourceLine(), tc.getLocation().toString());
    }

    @Test
    void testDirectRegistration() {
        TestRegistry registry = new TestRegistry();
        registry.register("manual", t -> {
        }, TestStatus.NORMAL, new SourceLocation("Manual.java", 7));
        TestCase tc = registry.listAll().get(0);
        assertEquals("Manual.java", tc.getSourceFile());
        assertEquals(7, tc.getSourceLine());
    }

    @Test
    void testInvalidRegistration() {
        TestRegistry registry = new TestRegistry();
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(null, t -> {
                }, TestStatus.NORMAL, SourceLocation.UNKNOWN));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("no action", null, TestStatus.NORMAL, SourceLocation.UNKNOWN));
        assertEquals(0, registry.size());
    }

    @Test
    void testGlobalIsSingleton() {
        assertSame(TestRegistry.global(), TestRegistry.global());
    }

}
