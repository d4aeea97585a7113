package info.isaksson.erland.xamlmigrate.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticBagTest {

    @Test
    void queriesBySeverityAndFile() {
        DiagnosticBag bag = new DiagnosticBag();
        bag.addError("E1", "broken", "a.xaml", 3, 7);
        bag.addWarning("W1", "odd", "b.xaml", 1, 1);
        bag.addInfo("I1", "fyi");

        assertTrue(bag.hasErrors());
        assertEquals(1, bag.bySeverity(DiagnosticSeverity.ERROR).size());
        assertEquals(1, bag.bySeverity(DiagnosticSeverity.WARNING).size());
        assertEquals("W1", bag.forFile("b.xaml").get(0).code);
        assertEquals(1, bag.forFile(null).size());
        assertEquals(1, bag.byCode("E1").size());
        assertEquals(Integer.valueOf(7), bag.all().get(0).column);
    }

    @Test
    void deterministicListIgnoresAppendOrder() {
        DiagnosticBag a = new DiagnosticBag();
        a.addWarning("B", "second", "f.xaml", 2, 1);
        a.addWarning("A", "first", "f.xaml", 1, 1);

        DiagnosticBag b = new DiagnosticBag();
        b.addWarning("A", "first", "f.xaml", 1, 1);
        b.addWarning("B", "second", "f.xaml", 2, 1);

        assertEquals(a.toDeterministicList(), b.toDeterministicList());
        assertEquals("A", a.toDeterministicList().get(0).code);
    }

    @Test
    void concurrentBagAcceptsParallelAppends() throws Exception {
        ConcurrentDiagnosticBag shared = new ConcurrentDiagnosticBag();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int file = t;
                futures.add(pool.submit(() -> {
                    DiagnosticBag local = new DiagnosticBag();
                    for (int i = 0; i < 250; i++) {
                        local.addInfo("I", "n" + i, "f" + file + ".xaml", i + 1, 1);
                    }
                    shared.mergeFrom(local);
                }));
            }
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1000, shared.all().size());
        assertEquals(250, shared.forFile("f2.xaml").size());
    }

    @Test
    void toStringIncludesLocation() {
        Diagnostic d = new Diagnostic(DiagnosticSeverity.ERROR, "XML_PARSE_ERROR", "bad", "a.xaml", 4, 2);
        assertEquals("ERROR XML_PARSE_ERROR [a.xaml:4:2]: bad", d.toString());
    }
}
