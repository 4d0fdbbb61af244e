package com.mm.chartdata.api;

import com.mm.chartdata.procedures.ProcedureWhitelistStore;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/** Maintains the stored procedures custom chart queries may {@code EXEC}. */
@RestController
@RequestMapping("api/database/stored-procedures")
public class StoredProceduresController {
  private final ProcedureWhitelistStore store;
  public StoredProceduresController(ProcedureWhitelistStore store) { this.store = store; }

  @GetMapping
  public Map<String, Object> list() {
    return Map.of("success", true, "procedures", store.current().names());
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Object> add(@RequestBody Map<String, String> body) {
    String name = body == null ? null : body.get("name");
    store.add(name);
    return Map.of("success", true, "name", name);
  }

  @DeleteMapping("{name}")
  public Map<String, Object> remove(@PathVariable String name) {
    if (!store.remove(name)) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Stored procedure '" + name + "' is not whitelisted");
    }
    return Map.of("success", true);
  }
}
