package com.gaiarust.cli;

import com.gaiarust.analysis.AnalysisConfig;
import com.gaiarust.analysis.AnalysisResult;
import com.gaiarust.analysis.SemanticDriver;
import com.gaiarust.hir.decl.HirModule;
import com.google.gson.JsonArray;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * picocli check 子命令：对 JSON HIR 模块做类型和生命周期检查
 */
@Command(name = "check", description = "检查 JSON HIR 模块的类型和生命周期")
public class CheckCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(CheckCommand.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", description = "JSON HIR 模块文件")
    List<Path> files;

    @Option(names = {"-j", "--jobs"}, defaultValue = "1", description = "并行分析的线程数（默认 1）")
    int jobs;

    @Option(names = "--max-iterations", defaultValue = "100000", description = "不动点迭代上限（默认 100000）")
    int maxIterations;

    @Option(names = "--fail-fast", description = "第一个出错的条目即停止")
    boolean failFast;

    @Option(names = "--json", description = "以 JSON 输出诊断")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "输出分析过程日志")
    boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) enableVerboseLogging();
        if (jobs < 1 || maxIterations < 1) {
            err.println("错误: --jobs 和 --max-iterations 必须为正数");
            return EXIT_BAD_INPUT;
        }

        AnalysisConfig config = new AnalysisConfig();
        config.setMaxFixpointIterations(maxIterations);
        config.setFailFast(failFast);
        SemanticDriver driver = new SemanticDriver(config);
        DiagnosticPrinter printer = new DiagnosticPrinter();

        int exitCode = EXIT_OK;
        JsonArray allJson = new JsonArray();
        ExecutorService pool = jobs > 1 ? newPool(jobs) : null;
        try {
            for (Path file : files) {
                HirModule module;
                try {
                    module = HirJsonReader.readFile(file);
                } catch (IOException | HirFormatException e) {
                    LOG.log(Level.WARNING, "无法读取输入: " + file, e);
                    err.println("错误: 无法读取 " + file + ": " + e.getMessage());
                    exitCode = EXIT_BAD_INPUT;
                    continue;
                }

                AnalysisResult result = pool != null
                        ? driver.analyzeParallel(module, pool)
                        : driver.analyze(module);
                if (json) {
                    allJson.addAll(printer.toJson(file.toString(), result.getDiagnostics()));
                } else {
                    printer.printText(result.getDiagnostics(), out);
                }
                if (result.hasErrors() && exitCode == EXIT_OK) {
                    exitCode = EXIT_DIAGNOSTICS;
                }
            }
        } finally {
            if (pool != null) pool.shutdownNow();
        }

        if (json) {
            printer.printJson(allJson, out);
        }
        out.flush();
        return exitCode;
    }

    private static ExecutorService newPool(int threads) {
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "gaia-analysis");
            t.setDaemon(true);
            return t;
        });
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }
}
