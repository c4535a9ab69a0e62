package com.example.excelops.web;

import com.example.excelops.service.automation.AutomationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api/automation")
@RequiredArgsConstructor
public class AutomationController {

    private final AutomationService automationService;

    @PostMapping("/run")
    public ResponseEntity<byte[]> run(@RequestParam("file") MultipartFile file,
                                      @RequestParam("users") List<String> users,
                                      @RequestParam("preset") String preset) throws IOException {
        ExcelOpsController.requireFile(file);
        byte[] bytes;
        try (InputStream in = file.getInputStream()) {
            bytes = automationService.run(in, file.getOriginalFilename(), users, preset);
        }
        return ExcelOpsController.xlsx(bytes, outputName(file.getOriginalFilename()));
    }

    private static String outputName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "automation_OUTPUT.xlsx";
        }
        int dot = fileName.lastIndexOf('.');
        return (dot > 0 ? fileName.substring(0, dot) : fileName) + "_OUTPUT.xlsx";
    }
}
