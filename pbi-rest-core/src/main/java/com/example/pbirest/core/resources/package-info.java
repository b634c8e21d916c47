/** Typed views over Power BI API payloads. */
package com.example.pbirest.core.resources;
