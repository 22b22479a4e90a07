package com.sporetrack.controller.rest;

import com.sporetrack.service.core.schema.SchemaDescription;
import com.sporetrack.service.core.schema.SchemaRegistry;
import java.util.UUID;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/schema")
public class SchemaController {
    private final SchemaRegistry schema;

    public SchemaController(SchemaRegistry schema) {
        this.schema = schema;
    }

    @GetMapping
    public SchemaDescription describe(@RequestHeader(TenantHeaders.TENANT) UUID tenantId) {
        return schema.describeSchema(TenantHeaders.context(tenantId, null));
    }
}
