package loadgen;

import loadgen.config.ApplianceConfig;
import loadgen.config.BatchConfig;
import loadgen.engine.ApplianceProfileGenerator;
import loadgen.engine.placement.PlacementResult;
import loadgen.io.ApplianceConfigLoader;
import loadgen.io.TimeSeriesCsvWriter;
import loadgen.io.TimeSeriesExcelWriter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Пакетная генерация профилей приборов.
 * Аргумент: путь к JSON пакетной конфигурации (по умолчанию batch.json).
 * Ошибка одного прибора не останавливает остальные.
 */
public class Main {

    public static void main(String[] args) {

        Path configPath = Paths.get(args.length > 0 ? args[0] : "batch.json");

        try {
            // 1) конфигурация
            BatchConfig batch = new ApplianceConfigLoader().load(configPath);
            Files.createDirectories(batch.getOutputDir());

            // 2) генерация по приборам
            ApplianceProfileGenerator generator = new ApplianceProfileGenerator();
            List<String> failed = new ArrayList<>();
            int saved = 0;

            for (Map.Entry<String, ApplianceConfig> e : batch.getAppliances().entrySet()) {
                String name = e.getKey();
                try {
                    PlacementResult result = generator.generate(
                            e.getValue(), batch.getStart(), batch.getEnd(), batch.getPatternsBaseDir());

                    // 3) выгрузка
                    Path csv = batch.getOutputDir().resolve(name + "_consumption.csv");
                    TimeSeriesCsvWriter.write(csv, result.series(), batch.isCsvHeader());
                    if (batch.isExportExcel()) {
                        Path xlsx = batch.getOutputDir().resolve(name + "_consumption.xlsx");
                        TimeSeriesExcelWriter.writeXlsx(xlsx, name, result.series());
                    }
                    saved++;
                    System.out.printf("%s: %d activations, %.1f Wh -> %s%n",
                            name, result.activationCount(), result.series().energyWh(), csv);

                } catch (Exception ex) {
                    failed.add(name);
                    System.err.println("Failed to generate pattern for " + name + ": " + ex.getMessage());
                    ex.printStackTrace();
                }
            }

            System.out.println("Saved: " + saved + " of " + batch.getAppliances().size()
                    + (failed.isEmpty() ? "" : ", failed: " + failed));

        } catch (Exception e) {
            System.err.println("Ошибка: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
