package com.kinshipkeeper.controller;

import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.service.PersonService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/people")
public class PersonApiController {

    private final PersonService personService;

    public PersonApiController(PersonService personService) {
        this.personService = personService;
    }

    // ========== READ OPERATIONS ==========

    @GetMapping
    public List<Person> listPersons(@AuthenticationPrincipal UserDetails user) {
        return personService.listPersons(user.getUsername());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Person> getPerson(@AuthenticationPrincipal UserDetails user, @PathVariable Long id) {
        return personService.getPerson(user.getUsername(), id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    // ========== CREATE/UPDATE/DELETE ==========

    @PostMapping
    public ResponseEntity<Person> createPerson(@AuthenticationPrincipal UserDetails user,
                                               @RequestBody Map<String, Object> body) {
        Person created = personService.createPerson(user.getUsername(), body);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Person> updatePerson(@AuthenticationPrincipal UserDetails user,
                                               @PathVariable Long id,
                                               @RequestBody Map<String, Object> body) {
        return personService.updatePerson(user.getUsername(), id, body)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePerson(@AuthenticationPrincipal UserDetails user, @PathVariable Long id) {
        if (!personService.deletePerson(user.getUsername(), id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
